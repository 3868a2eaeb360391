package github.sarthakdev143.animation_studio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AnimationStudioApplication {

	public static void main(String[] args) {
		SpringApplication.run(AnimationStudioApplication.class, args);
	}

}
