package com.gentoro.pricetracker.scheduler;

import com.gentoro.pricetracker.exception.ValidationException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Registration of a job: its descriptor plus the live {@link JobHandler}. Build with {@link
 * #builder(String, String, JobHandler)}.
 */
public final class JobDefinition {
  private final String jobId;
  private final String name;
  private final JobHandler handler;
  private final ScheduleType scheduleType;
  private final String scheduleValue;
  private final JobPriority priority;
  private final int maxRetries;
  private final Duration retryDelay;
  private final Duration timeout;
  private final boolean enabled;
  private final List<Object> args;
  private final Map<String, Object> kwargs;

  private JobDefinition(Builder b) {
    this.jobId = b.jobId;
    this.name = b.name;
    this.handler = b.handler;
    this.scheduleType = b.scheduleType;
    this.scheduleValue = b.scheduleValue;
    this.priority = b.priority;
    this.maxRetries = b.maxRetries;
    this.retryDelay = b.retryDelay;
    this.timeout = b.timeout;
    this.enabled = b.enabled;
    this.args = Collections.unmodifiableList(new ArrayList<>(b.args));
    this.kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(b.kwargs));
  }

  public static Builder builder(String jobId, String name, JobHandler handler) {
    return new Builder(jobId, name, handler);
  }

  public String jobId() {
    return jobId;
  }

  public String name() {
    return name;
  }

  public JobHandler handler() {
    return handler;
  }

  public ScheduleType scheduleType() {
    return scheduleType;
  }

  public String scheduleValue() {
    return scheduleValue;
  }

  public JobPriority priority() {
    return priority;
  }

  /** Recorded for reporting only; failed runs are not retried before the next regular run. */
  public int maxRetries() {
    return maxRetries;
  }

  /** Recorded for reporting only, see {@link #maxRetries()}. */
  public Duration retryDelay() {
    return retryDelay;
  }

  public Duration timeout() {
    return timeout;
  }

  public boolean enabled() {
    return enabled;
  }

  public List<Object> args() {
    return args;
  }

  public Map<String, Object> kwargs() {
    return kwargs;
  }

  public static final class Builder {
    private final String jobId;
    private final String name;
    private final JobHandler handler;
    private ScheduleType scheduleType;
    private String scheduleValue;
    private JobPriority priority = JobPriority.MEDIUM;
    private int maxRetries = 3;
    private Duration retryDelay = Duration.ofSeconds(60);
    private Duration timeout = Duration.ofSeconds(300);
    private boolean enabled = true;
    private final List<Object> args = new ArrayList<>();
    private final Map<String, Object> kwargs = new LinkedHashMap<>();

    private Builder(String jobId, String name, JobHandler handler) {
      this.jobId = jobId;
      this.name = name;
      this.handler = handler;
    }

    public Builder schedule(ScheduleType type, String value) {
      this.scheduleType = type;
      this.scheduleValue = value;
      return this;
    }

    public Builder schedule(ScheduleType type, long count) {
      return schedule(type, Long.toString(count));
    }

    public Builder priority(JobPriority priority) {
      this.priority = priority;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder retryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder timeoutSeconds(long seconds) {
      return timeout(Duration.ofSeconds(seconds));
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder args(Object... values) {
      args.addAll(Arrays.asList(values));
      return this;
    }

    public Builder kwarg(String key, Object value) {
      kwargs.put(key, value);
      return this;
    }

    public Builder kwargs(Map<String, ?> values) {
      kwargs.putAll(values);
      return this;
    }

    /**
     * @throws ValidationException when a required field is missing or a limit is out of range
     */
    public JobDefinition build() {
      if (StringUtils.isBlank(jobId)) {
        throw new ValidationException("Job id must not be blank");
      }
      if (StringUtils.isBlank(name)) {
        throw new ValidationException("Job name must not be blank").with("jobId", jobId);
      }
      if (handler == null) {
        throw new ValidationException("Job body must not be null").with("jobId", jobId);
      }
      if (scheduleType == null) {
        throw new ValidationException("Schedule type must be set").with("jobId", jobId);
      }
      if (priority == null) {
        throw new ValidationException("Priority must not be null").with("jobId", jobId);
      }
      if (timeout == null || timeout.isZero() || timeout.isNegative()) {
        throw new ValidationException("Timeout must be positive, got " + timeout)
            .with("jobId", jobId);
      }
      if (maxRetries < 0) {
        throw new ValidationException("Max retries must not be negative").with("jobId", jobId);
      }
      if (retryDelay == null || retryDelay.isNegative()) {
        throw new ValidationException("Retry delay must not be negative").with("jobId", jobId);
      }
      return new JobDefinition(this);
    }
  }
}
