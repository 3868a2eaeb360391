package github.sarthakdev143.animation_studio.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;

@Configuration
public class MediaResourceConfig implements WebMvcConfigurer {

    private final StudioProperties properties;

    public MediaResourceConfig(StudioProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler("/outputs/**")
                .addResourceLocations(directoryLocation(properties.outputPath()));
        registry.addResourceHandler("/uploads/**")
                .addResourceLocations(directoryLocation(properties.uploadPath()));
    }

    private String directoryLocation(Path directory) {
        String location = directory.toUri().toString();
        return location.endsWith("/") ? location : location + "/";
    }
}
