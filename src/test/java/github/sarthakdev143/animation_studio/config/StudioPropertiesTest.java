package github.sarthakdev143.animation_studio.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class StudioPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfiguration.class);

    @Test
    void bindsDefaultsAndOverrides() {
        contextRunner
                .withPropertyValues(
                        "animation-studio.render-progress-budget=70",
                        "animation-studio.combine-progress=90",
                        "animation-studio.manim-binary=/opt/manim/bin/manim")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    StudioProperties properties = context.getBean(StudioProperties.class);
                    assertThat(properties.getRenderProgressBudget()).isEqualTo(70);
                    assertThat(properties.getCombineProgress()).isEqualTo(90);
                    assertThat(properties.getManimBinary()).isEqualTo("/opt/manim/bin/manim");
                    assertThat(properties.getEntryClass()).isEqualTo("GeneratedScene");
                    assertThat(properties.getFallbackDurationSeconds()).isEqualTo(5.0);
                });
    }

    @Test
    void rejectsRenderProgressBudgetAboveOneHundred() {
        contextRunner
                .withPropertyValues("animation-studio.render-progress-budget=150")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .hasStackTraceContaining("renderProgressBudget");
                });
    }

    @Test
    void rejectsNegativeCombineProgress() {
        contextRunner
                .withPropertyValues("animation-studio.combine-progress=-1")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .hasStackTraceContaining("combineProgress");
                });
    }

    @Test
    void rejectsCombineProgressBelowRenderBudget() {
        contextRunner
                .withPropertyValues(
                        "animation-studio.render-progress-budget=90",
                        "animation-studio.combine-progress=85")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .hasStackTraceContaining("combine-progress must not be below render-progress-budget");
                });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(StudioProperties.class)
    static class PropertiesConfiguration {
    }
}
