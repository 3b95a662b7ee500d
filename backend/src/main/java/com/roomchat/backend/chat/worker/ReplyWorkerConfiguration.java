package com.roomchat.backend.chat.worker;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ReplyWorkerProperties.class)
public class ReplyWorkerConfiguration {

  @Bean(name = "replyWorkerExecutor", destroyMethod = "shutdown")
  public ExecutorService replyWorkerExecutor(ReplyWorkerProperties properties) {
    ThreadFactory threadFactory =
        new ThreadFactory() {
          private final AtomicInteger index = new AtomicInteger();

          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("reply-worker-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
          }
        };

    return Executors.newFixedThreadPool(properties.getMaxConcurrency(), threadFactory);
  }
}
