package org.prism.application.port;

/**
 * <strong>What:</strong> Port supplying a monotonic time source for parse latency measurements.
 * <p><strong>Role:</strong> Consumed by the color-run parser; tests inject fixed clocks.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current value of a monotonic nanosecond clock.
   *
   * @return nanoseconds relative to an arbitrary origin; only differences are meaningful
   */
  long nanoTime();

  /** Default {@link ClockPort} using {@link System#nanoTime()}. */
  ClockPort SYSTEM = System::nanoTime;
}
