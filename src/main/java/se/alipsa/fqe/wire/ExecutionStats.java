package se.alipsa.fqe.wire;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Execution statistics reported alongside a result.
 *
 * @param elapsedSeconds
 *          server side execution time
 * @param rowsRead
 *          rows scanned by the engine
 * @param bytesRead
 *          bytes scanned by the engine
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionStats(@JsonProperty("elapsed") double elapsedSeconds,
    @JsonProperty("rows_read") long rowsRead, @JsonProperty("bytes_read") long bytesRead) {

  public static final ExecutionStats NONE = new ExecutionStats(0, 0, 0);
}
