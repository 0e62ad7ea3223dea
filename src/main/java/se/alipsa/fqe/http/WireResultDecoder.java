package se.alipsa.fqe.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.fqe.error.ResultDecodeException;
import se.alipsa.fqe.wire.ColumnMeta;
import se.alipsa.fqe.wire.ExecutionStats;
import se.alipsa.fqe.wire.WireResult;
import se.alipsa.fqe.wire.WireType;
import se.alipsa.fqe.wire.WireValue;

/**
 * Decodes the engine's compact JSON result format.
 *
 * <pre>
 * {"meta": [{"name": ..., "type": ...}], "data": [[...]], "rows": n,
 *  "statistics": {"elapsed": s, "rows_read": n, "bytes_read": n}}
 * </pre>
 *
 * <p>
 * An empty body or a JSON {@code null} decodes to {@link WireResult#EMPTY}. Missing {@code meta}/{@code data} arrays
 * are read as empty, a missing {@code rows} as the number of data rows and missing statistics as zeros.
 * </p>
 */
public final class WireResultDecoder {

  private static final Logger log = LoggerFactory.getLogger(WireResultDecoder.class);

  private final ObjectMapper mapper;

  public WireResultDecoder() {
    this(new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false));
  }

  WireResultDecoder(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Decode a response body, failing on anything that is not a well-formed result.
   *
   * @param body
   *          the response body (may be {@code null})
   * @return the decoded result
   * @throws ResultDecodeException
   *           if the body is not valid JSON or does not have the result shape
   */
  public WireResult decode(String body) throws ResultDecodeException {
    if (body == null || body.isBlank()) {
      return WireResult.EMPTY;
    }
    JsonNode root;
    try {
      root = mapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new ResultDecodeException("Response is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || root.isNull() || root.isMissingNode()) {
      return WireResult.EMPTY;
    }
    if (!root.isObject()) {
      throw new ResultDecodeException("Expected a JSON object but got " + root.getNodeType());
    }
    List<ColumnMeta> columns = decodeColumns(root.path("meta"));
    List<List<WireValue>> rows = decodeRows(root.path("data"), columns);
    JsonNode rowsNode = root.get("rows");
    int rowCount = rowsNode != null && rowsNode.canConvertToInt() ? rowsNode.asInt() : rows.size();
    ExecutionStats stats = decodeStats(root.path("statistics"));
    return new WireResult(columns, rows, rowCount, stats);
  }

  /**
   * Decode a response body, treating anything undecodable as a result without tabular payload.
   *
   * @param body
   *          the response body (may be {@code null})
   * @return the decoded result or {@link WireResult#EMPTY}
   */
  public WireResult decodeLenient(String body) {
    try {
      return decode(body);
    } catch (ResultDecodeException e) {
      log.debug("Response has no tabular payload ({}), using an empty result", e.getMessage());
      return WireResult.EMPTY;
    }
  }

  private List<ColumnMeta> decodeColumns(JsonNode meta) throws ResultDecodeException {
    if (meta.isMissingNode() || meta.isNull()) {
      return List.of();
    }
    if (!meta.isArray()) {
      throw new ResultDecodeException("\"meta\" must be an array");
    }
    List<ColumnMeta> columns = new ArrayList<>(meta.size());
    for (JsonNode column : meta) {
      if (!column.isObject()) {
        throw new ResultDecodeException("\"meta\" entries must be objects");
      }
      try {
        columns.add(mapper.treeToValue(column, ColumnMeta.class));
      } catch (JsonProcessingException e) {
        throw new ResultDecodeException("Invalid column metadata: " + column, e);
      }
    }
    return columns;
  }

  private List<List<WireValue>> decodeRows(JsonNode data, List<ColumnMeta> columns) throws ResultDecodeException {
    if (data.isMissingNode() || data.isNull()) {
      return List.of();
    }
    if (!data.isArray()) {
      throw new ResultDecodeException("\"data\" must be an array");
    }
    List<List<WireValue>> rows = new ArrayList<>(data.size());
    for (JsonNode row : data) {
      if (!row.isArray()) {
        throw new ResultDecodeException("Row " + (rows.size() + 1) + " is not an array");
      }
      if (row.size() != columns.size()) {
        throw new ResultDecodeException("Row " + (rows.size() + 1) + " has " + row.size()
            + " cells but the result has " + columns.size() + " columns");
      }
      List<WireValue> cells = new ArrayList<>(row.size());
      for (int i = 0; i < row.size(); i++) {
        cells.add(toWireValue(row.get(i), columns.get(i)));
      }
      rows.add(cells);
    }
    return rows;
  }

  private ExecutionStats decodeStats(JsonNode statistics) {
    if (!statistics.isObject()) {
      return ExecutionStats.NONE;
    }
    try {
      return mapper.treeToValue(statistics, ExecutionStats.class);
    } catch (JsonProcessingException e) {
      log.warn("Ignoring malformed statistics {}: {}", statistics, e.getOriginalMessage());
      return ExecutionStats.NONE;
    }
  }

  static WireValue toWireValue(JsonNode node, ColumnMeta column) {
    if (node == null || node.isNull()) {
      return WireValue.NULL;
    }
    if (node.isBoolean()) {
      return new WireValue.Bool(node.booleanValue());
    }
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      return new WireValue.Int(node.longValue());
    }
    if (node.isNumber()) {
      return new WireValue.Decimal(node.decimalValue());
    }
    if (node.isTextual()) {
      if (column.type() == WireType.BLOB) {
        return new WireValue.Bytes(node.textValue().getBytes(StandardCharsets.UTF_8));
      }
      return new WireValue.Text(node.textValue());
    }
    return new WireValue.Text(node.toString());
  }
}
