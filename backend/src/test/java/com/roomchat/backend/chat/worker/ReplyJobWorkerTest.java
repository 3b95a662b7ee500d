package com.roomchat.backend.chat.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.roomchat.backend.chat.job.ReplyJob;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReplyJobWorkerTest {

  @Mock private ReplyJobProcessor processor;

  private SimpleMeterRegistry meterRegistry;
  private ReplyWorkerProperties properties;
  private ExecutorService executorService;
  private ReplyJobWorker worker;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    properties = new ReplyWorkerProperties();
    properties.setEnabled(true);
    properties.setWorkerIdPrefix("test-worker");
    executorService = new DirectExecutorService();
    worker = new ReplyJobWorker(processor, properties, meterRegistry, executorService);
  }

  @AfterEach
  void tearDown() {
    worker.shutdown();
    meterRegistry.close();
  }

  @Test
  void pollsQueueAndProcessesJob() {
    ReplyJob job = mock(ReplyJob.class);
    when(job.getId()).thenReturn(42L);
    when(processor.processNextJob(anyString())).thenReturn(Optional.of(job));

    worker.pollQueue();

    ArgumentCaptor<String> workerCaptor = ArgumentCaptor.forClass(String.class);
    verify(processor).processNextJob(workerCaptor.capture());
    assertThat(workerCaptor.getValue()).startsWith("test-worker-");
    assertThat(meterRegistry.counter("chat.reply.job.poll.count", "result", "processed").count())
        .isEqualTo(1.0d);
  }

  @Test
  void emptyQueueIsRecorded() {
    when(processor.processNextJob(anyString())).thenReturn(Optional.empty());

    worker.pollQueue();

    assertThat(meterRegistry.counter("chat.reply.job.poll.count", "result", "empty").count())
        .isEqualTo(1.0d);
  }

  @Test
  void disabledWorkerDoesNotPoll() {
    ReplyWorkerProperties disabled = new ReplyWorkerProperties();
    disabled.setEnabled(false);
    ReplyJobWorker disabledWorker =
        new ReplyJobWorker(processor, disabled, meterRegistry, executorService);

    disabledWorker.pollQueue();

    verify(processor, never()).processNextJob(anyString());
    assertThat(meterRegistry.find("chat.reply.job.poll.count").counter()).isNull();
  }

  @Test
  void processingErrorsAreRecordedAndSwallowed() {
    when(processor.processNextJob(anyString())).thenThrow(new IllegalStateException("boom"));

    worker.pollQueue();
    worker.pollQueue();

    assertThat(meterRegistry.counter("chat.reply.job.poll.count", "result", "error").count())
        .isEqualTo(2.0d);
  }

  private static final class DirectExecutorService extends AbstractExecutorService {

    private volatile boolean shutdown;

    @Override
    public void shutdown() {
      shutdown = true;
    }

    @Override
    public List<Runnable> shutdownNow() {
      shutdown = true;
      return Collections.emptyList();
    }

    @Override
    public boolean isShutdown() {
      return shutdown;
    }

    @Override
    public boolean isTerminated() {
      return shutdown;
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) {
      return shutdown;
    }

    @Override
    public void execute(Runnable command) {
      command.run();
    }
  }
}
