package github.sarthakdev143.animation_studio.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;

/**
 * Executor for render jobs. Each submitted job gets its own thread and there is no
 * concurrency limit, so a burst of submissions fans out without queueing.
 */
@Configuration
public class RenderExecutorConfig {

    @Bean(name = "renderTaskExecutor")
    public TaskExecutor renderTaskExecutor() {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("render-job-");
        executor.setDaemon(false);
        return executor;
    }
}
