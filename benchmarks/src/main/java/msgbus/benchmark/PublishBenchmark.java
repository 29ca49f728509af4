package msgbus.benchmark;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import msgbus.Message;
import msgbus.MessageBus;
import msgbus.Priority;
import msgbus.PublishResult;
import msgbus.retry.RetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Measures publish cost with a growing subscriber list, synchronously and through the async
 * executor.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar PublishBenchmark}
 * <p>Filtered: {@code java -jar benchmarks/target/benchmarks.jar -p filtered=true PublishBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class PublishBenchmark {

  private static final int BENCH_TYPE = 1;

  private MessageBus bus;
  private Message message;

  @Param({"1", "10", "100"})
  private int subscribers;

  @Param({"false", "true"})
  private boolean filtered;

  @Setup(Level.Trial)
  public void setup() {
    bus = MessageBus.builder()
        .retryPolicy(RetryPolicy.none())
        .healthCheckInterval(Duration.ZERO)
        .build();
    bus.registerType(BENCH_TYPE, "BenchEvent");

    List<Object> sink = new ArrayList<>(1);
    sink.add(null);
    for (int i = 0; i < subscribers; i++) {
      if (filtered && i % 2 == 1) {
        bus.subscribe(BENCH_TYPE, m -> sink.set(0, m.payload()), null, Priority.HIGH);
      } else {
        bus.subscribe(BENCH_TYPE, m -> sink.set(0, m.payload()));
      }
    }
    message = Message.builder(BENCH_TYPE).payload("payload").build();
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    bus.close();
  }

  @Benchmark
  public PublishResult publish() {
    return bus.publish(message);
  }

  @Benchmark
  public void publishAsync(Blackhole bh) throws Exception {
    bh.consume(bus.publishAsync(message).get(5, TimeUnit.SECONDS));
  }
}
