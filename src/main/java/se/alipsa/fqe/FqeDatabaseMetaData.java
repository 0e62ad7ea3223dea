package se.alipsa.fqe;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.RowIdLifetime;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import se.alipsa.fqe.helper.FqeUtil;
import se.alipsa.fqe.helper.ParameterBinder;
import se.alipsa.fqe.helper.WireCoercions;
import se.alipsa.fqe.wire.WireResult;
import se.alipsa.fqe.wire.WireType;
import se.alipsa.fqe.wire.WireValue;

/**
 * An implementation of the java.sql.DatabaseMetaData interface for the federated query engine.
 *
 * <p>
 * Capability flags are static. Catalog, schema, table and column listings are read from the engine's
 * {@code information_schema} over the connection's transport; all other catalog queries return empty result sets
 * with the standard JDBC columns.
 * </p>
 */
@SuppressWarnings({"checkstyle:AbbreviationAsWordInName", "checkstyle:MethodCount"})
public class FqeDatabaseMetaData implements DatabaseMetaData {

  public static final String PRODUCT_NAME = "DuckDB Federated Query Engine";
  public static final String PRODUCT_VERSION = "1.0.0";

  private static final String[] TABLE_HEADERS = {
      "TABLE_CAT", "TABLE_SCHEM", "TABLE_NAME", "TABLE_TYPE", "REMARKS", "TYPE_CAT", "TYPE_SCHEM", "TYPE_NAME",
      "SELF_REFERENCING_COL_NAME", "REF_GENERATION"
  };
  private static final String[] COLUMN_HEADERS = {
      "TABLE_CAT", "TABLE_SCHEM", "TABLE_NAME", "COLUMN_NAME", "DATA_TYPE", "TYPE_NAME", "COLUMN_SIZE",
      "BUFFER_LENGTH", "DECIMAL_DIGITS", "NUM_PREC_RADIX", "NULLABLE", "REMARKS", "COLUMN_DEF", "SQL_DATA_TYPE",
      "SQL_DATETIME_SUB", "CHAR_OCTET_LENGTH", "ORDINAL_POSITION", "IS_NULLABLE", "SCOPE_CATALOG", "SCOPE_SCHEMA",
      "SCOPE_TABLE", "SOURCE_DATA_TYPE", "IS_AUTOINCREMENT", "IS_GENERATEDCOLUMN"
  };
  private static final String[] SCHEMA_HEADERS = {
      "TABLE_SCHEM", "TABLE_CATALOG"
  };

  private final FqeConnection conn;

  /**
   * Constructor.
   *
   * @param conn
   *          the connection whose transport catalog queries are sent over
   */
  public FqeDatabaseMetaData(FqeConnection conn) {
    this.conn = conn;
  }

  // --- catalog queries against information_schema ---

  @Override
  public ResultSet getTables(String catalog, String schemaPattern, String tableNamePattern, String[] types)
      throws SQLException {
    Set<String> typeFilter = null;
    if (types != null && types.length > 0) {
      typeFilter = new LinkedHashSet<>();
      for (String type : types) {
        if (type != null) {
          typeFilter.add(type.toUpperCase(Locale.ROOT));
        }
      }
    }
    StringBuilder sql = new StringBuilder(
        "SELECT table_catalog, table_schema, table_name, table_type FROM information_schema.tables WHERE 1=1");
    appendEquals(sql, "table_catalog", catalog);
    appendLike(sql, "table_schema", schemaPattern);
    appendLike(sql, "table_name", tableNamePattern);
    sql.append(" ORDER BY table_type, table_catalog, table_schema, table_name");
    List<Object[]> rows = new ArrayList<>();
    for (List<WireValue> row : query(sql.toString()).rows()) {
      String tableType = jdbcTableType(WireCoercions.toText(row.get(3)));
      if (typeFilter != null && !typeFilter.contains(tableType)) {
        continue;
      }
      rows.add(new Object[]{
          text(row, 0), text(row, 1), text(row, 2), tableType, null, null, null, null, null, null
      });
    }
    return FqeUtil.listResultSet(TABLE_HEADERS, rows);
  }

  private static String jdbcTableType(String engineType) {
    if (engineType == null) {
      return "TABLE";
    }
    String upper = engineType.toUpperCase(Locale.ROOT);
    return "BASE TABLE".equals(upper) ? "TABLE" : upper;
  }

  @Override
  public ResultSet getColumns(String catalog, String schemaPattern, String tableNamePattern, String columnNamePattern)
      throws SQLException {
    StringBuilder sql = new StringBuilder("SELECT table_catalog, table_schema, table_name, column_name, "
        + "ordinal_position, is_nullable, data_type, column_default, character_maximum_length, numeric_precision, "
        + "numeric_scale FROM information_schema.columns WHERE 1=1");
    appendEquals(sql, "table_catalog", catalog);
    appendLike(sql, "table_schema", schemaPattern);
    appendLike(sql, "table_name", tableNamePattern);
    appendLike(sql, "column_name", columnNamePattern);
    sql.append(" ORDER BY table_catalog, table_schema, table_name, ordinal_position");
    List<Object[]> rows = new ArrayList<>();
    for (List<WireValue> row : query(sql.toString()).rows()) {
      String typeName = text(row, 6);
      WireType type = WireType.of(typeName);
      boolean nullable = !"NO".equalsIgnoreCase(text(row, 5));
      Integer charLength = row.get(8).isNull() ? null : WireCoercions.toInt(row.get(8));
      Integer precision = row.get(9).isNull() ? null : WireCoercions.toInt(row.get(9));
      Integer scale = row.get(10).isNull() ? null : WireCoercions.toInt(row.get(10));
      Integer columnSize = charLength != null ? charLength : precision != null ? precision : type.precision();
      rows.add(new Object[]{
          text(row, 0), text(row, 1), text(row, 2), text(row, 3), type.jdbcType(), typeName, columnSize, null,
          scale, type.isNumeric() ? 10 : null,
          nullable ? columnNullable : columnNoNulls, null, text(row, 7), null, null, charLength,
          WireCoercions.toInt(row.get(4)), nullable ? "YES" : "NO", null, null, null, null, "NO", "NO"
      });
    }
    return FqeUtil.listResultSet(COLUMN_HEADERS, rows);
  }

  @Override
  public ResultSet getSchemas() throws SQLException {
    return getSchemas(null, null);
  }

  @Override
  public ResultSet getSchemas(String catalog, String schemaPattern) throws SQLException {
    StringBuilder sql = new StringBuilder(
        "SELECT schema_name, catalog_name FROM information_schema.schemata WHERE 1=1");
    appendEquals(sql, "catalog_name", catalog);
    appendLike(sql, "schema_name", schemaPattern);
    sql.append(" ORDER BY catalog_name, schema_name");
    List<Object[]> rows = new ArrayList<>();
    for (List<WireValue> row : query(sql.toString()).rows()) {
      rows.add(new Object[]{
          text(row, 0), text(row, 1)
      });
    }
    return FqeUtil.listResultSet(SCHEMA_HEADERS, rows);
  }

  @Override
  public ResultSet getCatalogs() throws SQLException {
    List<Object[]> rows = new ArrayList<>();
    for (List<WireValue> row : query(
        "SELECT DISTINCT catalog_name FROM information_schema.schemata ORDER BY catalog_name").rows()) {
      rows.add(new Object[]{
          text(row, 0)
      });
    }
    return FqeUtil.listResultSet(new String[]{
        "TABLE_CAT"
    }, rows);
  }

  @Override
  public ResultSet getTableTypes() throws SQLException {
    return FqeUtil.listResultSet(new String[]{
        "TABLE_TYPE"
    }, List.of(new Object[]{
        "LOCAL TEMPORARY"
    }, new Object[]{
        "TABLE"
    }, new Object[]{
        "VIEW"
    }));
  }

  /**
   * Describe the wire types this driver maps.
   *
   * @return a {@link ResultSet} adhering to the JDBC type info contract
   */
  @Override
  public ResultSet getTypeInfo() throws SQLException {
    List<Object[]> rows = new ArrayList<>();
    for (WireType type : WireType.values()) {
      if (type == WireType.OTHER) {
        continue;
      }
      boolean quoted = !type.isNumeric() && type != WireType.BOOLEAN;
      rows.add(new Object[]{
          type == WireType.TIMESTAMP_TZ ? "TIMESTAMP WITH TIME ZONE" : type.name(), type.jdbcType(),
          type.precision(), quoted ? "'" : null, quoted ? "'" : null,
          type == WireType.DECIMAL ? "precision,scale" : null, (short) typeNullable,
          type.category() == WireType.Category.TEXT, (short) typeSearchable, !type.signed(), false, false,
          type.name(), (short) 0, type == WireType.DECIMAL ? (short) 38 : (short) 0, null, null,
          type.isNumeric() ? 10 : null
      });
    }
    return FqeUtil.listResultSet(new String[]{
        "TYPE_NAME", "DATA_TYPE", "PRECISION", "LITERAL_PREFIX", "LITERAL_SUFFIX", "CREATE_PARAMS", "NULLABLE",
        "CASE_SENSITIVE", "SEARCHABLE", "UNSIGNED_ATTRIBUTE", "FIXED_PREC_SCALE", "AUTO_INCREMENT", "LOCAL_TYPE_NAME",
        "MINIMUM_SCALE", "MAXIMUM_SCALE", "SQL_DATA_TYPE", "SQL_DATETIME_SUB", "NUM_PREC_RADIX"
    }, rows);
  }

  private WireResult query(String sql) throws SQLException {
    return conn.transport().executeQuery(sql);
  }

  private static String text(List<WireValue> row, int index) {
    return WireCoercions.toText(row.get(index));
  }

  private static void appendEquals(StringBuilder sql, String column, String value) {
    if (value != null && !value.isEmpty()) {
      sql.append(" AND ").append(column).append(" = ").append(ParameterBinder.quote(value));
    }
  }

  private static void appendLike(StringBuilder sql, String column, String pattern) {
    if (pattern != null && !"%".equals(pattern)) {
      sql.append(" AND ").append(column).append(" LIKE ").append(ParameterBinder.quote(pattern))
          .append(" ESCAPE '\\'");
    }
  }

  private static ResultSet emptyResultSet(String... headers) {
    return FqeUtil.listResultSet(headers, List.of());
  }

  // --- empty catalog queries ---

  /**
   * Stored procedures are not supported.
   *
   * @return an empty result set
   */
  @Override
  public ResultSet getProcedures(String catalog, String schemaPattern, String procedureNamePattern) {
    return emptyResultSet("PROCEDURE_CAT", "PROCEDURE_SCHEM", "PROCEDURE_NAME", "reserved1", "reserved2",
        "reserved3", "REMARKS", "PROCEDURE_TYPE", "SPECIFIC_NAME");
  }

  @Override
  public ResultSet getProcedureColumns(String catalog, String schemaPattern, String procedureNamePattern,
      String columnNamePattern) {
    return emptyResultSet("PROCEDURE_CAT", "PROCEDURE_SCHEM", "PROCEDURE_NAME", "COLUMN_NAME", "COLUMN_TYPE",
        "DATA_TYPE", "TYPE_NAME", "PRECISION", "LENGTH", "SCALE", "RADIX", "NULLABLE", "REMARKS", "COLUMN_DEF",
        "SQL_DATA_TYPE", "SQL_DATETIME_SUB", "CHAR_OCTET_LENGTH", "ORDINAL_POSITION", "IS_NULLABLE", "SPECIFIC_NAME");
  }

  @Override
  public ResultSet getColumnPrivileges(String catalog, String schema, String table, String columnNamePattern) {
    return emptyResultSet("TABLE_CAT", "TABLE_SCHEM", "TABLE_NAME", "COLUMN_NAME", "GRANTOR", "GRANTEE", "PRIVILEGE",
        "IS_GRANTABLE");
  }

  @Override
  public ResultSet getTablePrivileges(String catalog, String schemaPattern, String tableNamePattern) {
    return emptyResultSet("TABLE_CAT", "TABLE_SCHEM", "TABLE_NAME", "GRANTOR", "GRANTEE", "PRIVILEGE", "IS_GRANTABLE");
  }

  @Override
  public ResultSet getBestRowIdentifier(String catalog, String schema, String table, int scope, boolean nullable) {
    return emptyResultSet("SCOPE", "COLUMN_NAME", "DATA_TYPE", "TYPE_NAME", "COLUMN_SIZE", "BUFFER_LENGTH",
        "DECIMAL_DIGITS", "PSEUDO_COLUMN");
  }

  @Override
  public ResultSet getVersionColumns(String catalog, String schema, String table) {
    return emptyResultSet("SCOPE", "COLUMN_NAME", "DATA_TYPE", "TYPE_NAME", "COLUMN_SIZE", "BUFFER_LENGTH",
        "DECIMAL_DIGITS", "PSEUDO_COLUMN");
  }

  @Override
  public ResultSet getPrimaryKeys(String catalog, String schema, String table) {
    return emptyResultSet("TABLE_CAT", "TABLE_SCHEM", "TABLE_NAME", "COLUMN_NAME", "KEY_SEQ", "PK_NAME");
  }

  @Override
  public ResultSet getImportedKeys(String catalog, String schema, String table) {
    return emptyKeys();
  }

  @Override
  public ResultSet getExportedKeys(String catalog, String schema, String table) {
    return emptyKeys();
  }

  @Override
  public ResultSet getCrossReference(String parentCatalog, String parentSchema, String parentTable,
      String foreignCatalog, String foreignSchema, String foreignTable) {
    return emptyKeys();
  }

  private static ResultSet emptyKeys() {
    return emptyResultSet("PKTABLE_CAT", "PKTABLE_SCHEM", "PKTABLE_NAME", "PKCOLUMN_NAME", "FKTABLE_CAT",
        "FKTABLE_SCHEM", "FKTABLE_NAME", "FKCOLUMN_NAME", "KEY_SEQ", "UPDATE_RULE", "DELETE_RULE", "FK_NAME", "PK_NAME",
        "DEFERRABILITY");
  }

  @Override
  public ResultSet getIndexInfo(String catalog, String schema, String table, boolean unique, boolean approximate) {
    return emptyResultSet("TABLE_CAT", "TABLE_SCHEM", "TABLE_NAME", "NON_UNIQUE", "INDEX_QUALIFIER", "INDEX_NAME",
        "TYPE", "ORDINAL_POSITION", "COLUMN_NAME", "ASC_OR_DESC", "CARDINALITY", "PAGES", "FILTER_CONDITION");
  }

  @Override
  public ResultSet getUDTs(String catalog, String schemaPattern, String typeNamePattern, int[] types) {
    return emptyResultSet("TYPE_CAT", "TYPE_SCHEM", "TYPE_NAME", "CLASS_NAME", "DATA_TYPE", "REMARKS", "BASE_TYPE");
  }

  @Override
  public ResultSet getSuperTypes(String catalog, String schemaPattern, String typeNamePattern) {
    return emptyResultSet("TYPE_CAT", "TYPE_SCHEM", "TYPE_NAME", "SUPERTYPE_CAT", "SUPERTYPE_SCHEM", "SUPERTYPE_NAME");
  }

  @Override
  public ResultSet getSuperTables(String catalog, String schemaPattern, String tableNamePattern) {
    return emptyResultSet("TABLE_CAT", "TABLE_SCHEM", "TABLE_NAME", "SUPERTABLE_NAME");
  }

  @Override
  public ResultSet getAttributes(String catalog, String schemaPattern, String typeNamePattern,
      String attributeNamePattern) {
    return emptyResultSet("TYPE_CAT", "TYPE_SCHEM", "TYPE_NAME", "ATTR_NAME", "DATA_TYPE", "ATTR_TYPE_NAME",
        "ATTR_SIZE", "DECIMAL_DIGITS", "NUM_PREC_RADIX", "NULLABLE", "REMARKS", "ATTR_DEF", "SQL_DATA_TYPE",
        "SQL_DATETIME_SUB", "CHAR_OCTET_LENGTH", "ORDINAL_POSITION", "IS_NULLABLE", "SCOPE_CATALOG", "SCOPE_SCHEMA",
        "SCOPE_TABLE", "SOURCE_DATA_TYPE");
  }

  @Override
  public ResultSet getClientInfoProperties() {
    return emptyResultSet("NAME", "MAX_LEN", "DEFAULT_VALUE", "DESCRIPTION");
  }

  @Override
  public ResultSet getFunctions(String catalog, String schemaPattern, String functionNamePattern) {
    return emptyResultSet("FUNCTION_CAT", "FUNCTION_SCHEM", "FUNCTION_NAME", "REMARKS", "FUNCTION_TYPE",
        "SPECIFIC_NAME");
  }

  @Override
  public ResultSet getFunctionColumns(String catalog, String schemaPattern, String functionNamePattern,
      String columnNamePattern) {
    return emptyResultSet("FUNCTION_CAT", "FUNCTION_SCHEM", "FUNCTION_NAME", "COLUMN_NAME", "COLUMN_TYPE", "DATA_TYPE",
        "TYPE_NAME", "PRECISION", "LENGTH", "SCALE", "RADIX", "NULLABLE", "REMARKS", "CHAR_OCTET_LENGTH",
        "ORDINAL_POSITION", "IS_NULLABLE", "SPECIFIC_NAME");
  }

  @Override
  public ResultSet getPseudoColumns(String catalog, String schemaPattern, String tableNamePattern,
      String columnNamePattern) {
    return emptyResultSet("TABLE_CAT", "TABLE_SCHEM", "TABLE_NAME", "COLUMN_NAME", "DATA_TYPE", "COLUMN_SIZE",
        "DECIMAL_DIGITS", "NUM_PREC_RADIX", "COLUMN_USAGE", "REMARKS", "CHAR_OCTET_LENGTH", "IS_NULLABLE");
  }

  // --- product and driver ---

  @Override
  public String getURL() {
    return conn.getUrl();
  }

  @Override
  public String getUserName() {
    return conn.getDescriptor().user();
  }

  @Override
  public Connection getConnection() {
    return conn;
  }

  @Override
  public String getDatabaseProductName() {
    return PRODUCT_NAME;
  }

  @Override
  public String getDatabaseProductVersion() {
    return PRODUCT_VERSION;
  }

  @Override
  public int getDatabaseMajorVersion() {
    return 1;
  }

  @Override
  public int getDatabaseMinorVersion() {
    return 0;
  }

  @Override
  public String getDriverName() {
    return FqeDriver.DRIVER_NAME;
  }

  @Override
  public String getDriverVersion() {
    return FqeDriver.DRIVER_VERSION;
  }

  @Override
  public int getDriverMajorVersion() {
    return FqeDriver.MAJOR_VERSION;
  }

  @Override
  public int getDriverMinorVersion() {
    return FqeDriver.MINOR_VERSION;
  }

  @Override
  public int getJDBCMajorVersion() {
    return 4;
  }

  @Override
  public int getJDBCMinorVersion() {
    return 2;
  }

  @Override
  public int getSQLStateType() {
    return sqlStateSQL;
  }

  @Override
  public boolean isReadOnly() throws SQLException {
    return conn.isReadOnly();
  }

  // --- transactions: none ---

  @Override
  public boolean supportsTransactions() {
    return false;
  }

  @Override
  public int getDefaultTransactionIsolation() {
    return Connection.TRANSACTION_NONE;
  }

  @Override
  public boolean supportsTransactionIsolationLevel(int level) {
    return level == Connection.TRANSACTION_NONE;
  }

  @Override
  public boolean supportsMultipleTransactions() {
    return false;
  }

  @Override
  public boolean supportsDataDefinitionAndDataManipulationTransactions() {
    return false;
  }

  @Override
  public boolean supportsDataManipulationTransactionsOnly() {
    return false;
  }

  @Override
  public boolean dataDefinitionCausesTransactionCommit() {
    return false;
  }

  @Override
  public boolean dataDefinitionIgnoredInTransactions() {
    return false;
  }

  @Override
  public boolean supportsSavepoints() {
    return false;
  }

  @Override
  public boolean autoCommitFailureClosesAllResultSets() {
    return false;
  }

  @Override
  public boolean supportsOpenCursorsAcrossCommit() {
    return true;
  }

  @Override
  public boolean supportsOpenCursorsAcrossRollback() {
    return true;
  }

  @Override
  public boolean supportsOpenStatementsAcrossCommit() {
    return true;
  }

  @Override
  public boolean supportsOpenStatementsAcrossRollback() {
    return true;
  }

  // --- result sets and statements ---

  @Override
  public boolean supportsResultSetType(int type) {
    return type == ResultSet.TYPE_FORWARD_ONLY || type == ResultSet.TYPE_SCROLL_INSENSITIVE;
  }

  @Override
  public boolean supportsResultSetConcurrency(int type, int concurrency) {
    return supportsResultSetType(type) && concurrency == ResultSet.CONCUR_READ_ONLY;
  }

  @Override
  public boolean supportsResultSetHoldability(int holdability) {
    return holdability == ResultSet.HOLD_CURSORS_OVER_COMMIT;
  }

  @Override
  public int getResultSetHoldability() {
    return ResultSet.HOLD_CURSORS_OVER_COMMIT;
  }

  @Override
  public boolean ownUpdatesAreVisible(int type) {
    return false;
  }
  @Override
  public boolean ownDeletesAreVisible(int type) {
    return false;
  }
  @Override
  public boolean ownInsertsAreVisible(int type) {
    return false;
  }
  @Override
  public boolean othersUpdatesAreVisible(int type) {
    return false;
  }
  @Override
  public boolean othersDeletesAreVisible(int type) {
    return false;
  }
  @Override
  public boolean othersInsertsAreVisible(int type) {
    return false;
  }
  @Override
  public boolean updatesAreDetected(int type) {
    return false;
  }
  @Override
  public boolean deletesAreDetected(int type) {
    return false;
  }
  @Override
  public boolean insertsAreDetected(int type) {
    return false;
  }

  @Override
  public boolean supportsBatchUpdates() {
    return false;
  }

  @Override
  public boolean supportsMultipleResultSets() {
    return false;
  }

  @Override
  public boolean supportsMultipleOpenResults() {
    return false;
  }

  @Override
  public boolean supportsGetGeneratedKeys() {
    return false;
  }

  @Override
  public boolean generatedKeyAlwaysReturned() {
    return false;
  }

  @Override
  public boolean supportsNamedParameters() {
    return false;
  }

  @Override
  public boolean supportsStatementPooling() {
    return false;
  }

  @Override
  public boolean supportsPositionedDelete() {
    return false;
  }

  @Override
  public boolean supportsPositionedUpdate() {
    return false;
  }

  @Override
  public boolean supportsSelectForUpdate() {
    return false;
  }

  @Override
  public boolean supportsStoredProcedures() {
    return false;
  }

  @Override
  public boolean supportsStoredFunctionsUsingCallSyntax() {
    return false;
  }

  @Override
  public boolean allProceduresAreCallable() {
    return false;
  }

  @Override
  public boolean allTablesAreSelectable() {
    return true;
  }

  @Override
  public RowIdLifetime getRowIdLifetime() {
    return RowIdLifetime.ROWID_UNSUPPORTED;
  }

  @Override
  public boolean locatorsUpdateCopy() {
    return false;
  }

  // --- SQL dialect ---

  @Override
  public String getIdentifierQuoteString() {
    return "\"";
  }

  @Override
  public String getSQLKeywords() {
    return "ATTACH,DETACH,DESCRIBE,EXPORT,IMPORT,INSTALL,LOAD,PIVOT,PRAGMA,QUALIFY,SHOW,SUMMARIZE,UNPIVOT,USE";
  }

  @Override
  public String getNumericFunctions() {
    return "ABS,ACOS,ASIN,ATAN,ATAN2,CEILING,COS,COT,DEGREES,EXP,FLOOR,LOG,LOG10,MOD,PI,POWER,RADIANS,RAND,ROUND,"
        + "SIGN,SIN,SQRT,TAN,TRUNCATE";
  }

  @Override
  public String getStringFunctions() {
    return "ASCII,CHAR,CONCAT,LCASE,LEFT,LENGTH,LOCATE,LTRIM,REPEAT,REPLACE,RIGHT,RTRIM,SUBSTRING,UCASE";
  }

  @Override
  public String getSystemFunctions() {
    return "DATABASE,IFNULL,USER";
  }

  @Override
  public String getTimeDateFunctions() {
    return "CURDATE,CURTIME,DAYNAME,DAYOFMONTH,DAYOFWEEK,DAYOFYEAR,HOUR,MINUTE,MONTH,MONTHNAME,NOW,QUARTER,SECOND,"
        + "WEEK,YEAR";
  }

  @Override
  public String getSearchStringEscape() {
    return "\\";
  }

  @Override
  public String getExtraNameCharacters() {
    return "";
  }

  @Override
  public String getSchemaTerm() {
    return "schema";
  }

  @Override
  public String getProcedureTerm() {
    return "procedure";
  }

  @Override
  public String getCatalogTerm() {
    return "catalog";
  }

  @Override
  public boolean isCatalogAtStart() {
    return true;
  }

  @Override
  public String getCatalogSeparator() {
    return ".";
  }

  @Override
  public boolean nullsAreSortedHigh() {
    return false;
  }
  @Override
  public boolean nullsAreSortedLow() {
    return false;
  }
  @Override
  public boolean nullsAreSortedAtStart() {
    return false;
  }
  @Override
  public boolean nullsAreSortedAtEnd() {
    return true;
  }

  @Override
  public boolean usesLocalFiles() {
    return false;
  }
  @Override
  public boolean usesLocalFilePerTable() {
    return false;
  }

  @Override
  public boolean supportsMixedCaseIdentifiers() {
    return false;
  }
  @Override
  public boolean storesUpperCaseIdentifiers() {
    return false;
  }
  @Override
  public boolean storesLowerCaseIdentifiers() {
    return false;
  }
  @Override
  public boolean storesMixedCaseIdentifiers() {
    return true;
  }
  @Override
  public boolean supportsMixedCaseQuotedIdentifiers() {
    return false;
  }
  @Override
  public boolean storesUpperCaseQuotedIdentifiers() {
    return false;
  }
  @Override
  public boolean storesLowerCaseQuotedIdentifiers() {
    return false;
  }
  @Override
  public boolean storesMixedCaseQuotedIdentifiers() {
    return true;
  }

  @Override
  public boolean supportsAlterTableWithAddColumn() {
    return true;
  }
  @Override
  public boolean supportsAlterTableWithDropColumn() {
    return true;
  }
  @Override
  public boolean supportsColumnAliasing() {
    return true;
  }
  @Override
  public boolean nullPlusNonNullIsNull() {
    return true;
  }
  @Override
  public boolean supportsConvert() {
    return true;
  }
  @Override
  public boolean supportsConvert(int fromType, int toType) {
    return fromType != Types.BLOB && toType != Types.BLOB || fromType == toType;
  }
  @Override
  public boolean supportsTableCorrelationNames() {
    return true;
  }
  @Override
  public boolean supportsDifferentTableCorrelationNames() {
    return false;
  }
  @Override
  public boolean supportsExpressionsInOrderBy() {
    return true;
  }
  @Override
  public boolean supportsOrderByUnrelated() {
    return true;
  }
  @Override
  public boolean supportsGroupBy() {
    return true;
  }
  @Override
  public boolean supportsGroupByUnrelated() {
    return true;
  }
  @Override
  public boolean supportsGroupByBeyondSelect() {
    return true;
  }
  @Override
  public boolean supportsLikeEscapeClause() {
    return true;
  }
  @Override
  public boolean supportsNonNullableColumns() {
    return true;
  }
  @Override
  public boolean supportsMinimumSQLGrammar() {
    return true;
  }
  @Override
  public boolean supportsCoreSQLGrammar() {
    return true;
  }
  @Override
  public boolean supportsExtendedSQLGrammar() {
    return false;
  }
  @Override
  public boolean supportsANSI92EntryLevelSQL() {
    return true;
  }
  @Override
  public boolean supportsANSI92IntermediateSQL() {
    return false;
  }
  @Override
  public boolean supportsANSI92FullSQL() {
    return false;
  }
  @Override
  public boolean supportsIntegrityEnhancementFacility() {
    return false;
  }
  @Override
  public boolean supportsOuterJoins() {
    return true;
  }
  @Override
  public boolean supportsFullOuterJoins() {
    return true;
  }
  @Override
  public boolean supportsLimitedOuterJoins() {
    return true;
  }
  @Override
  public boolean supportsSchemasInDataManipulation() {
    return true;
  }
  @Override
  public boolean supportsSchemasInProcedureCalls() {
    return false;
  }
  @Override
  public boolean supportsSchemasInTableDefinitions() {
    return true;
  }
  @Override
  public boolean supportsSchemasInIndexDefinitions() {
    return true;
  }
  @Override
  public boolean supportsSchemasInPrivilegeDefinitions() {
    return false;
  }
  @Override
  public boolean supportsCatalogsInDataManipulation() {
    return true;
  }
  @Override
  public boolean supportsCatalogsInProcedureCalls() {
    return false;
  }
  @Override
  public boolean supportsCatalogsInTableDefinitions() {
    return true;
  }
  @Override
  public boolean supportsCatalogsInIndexDefinitions() {
    return false;
  }
  @Override
  public boolean supportsCatalogsInPrivilegeDefinitions() {
    return false;
  }
  @Override
  public boolean supportsSubqueriesInComparisons() {
    return true;
  }
  @Override
  public boolean supportsSubqueriesInExists() {
    return true;
  }
  @Override
  public boolean supportsSubqueriesInIns() {
    return true;
  }
  @Override
  public boolean supportsSubqueriesInQuantifieds() {
    return true;
  }
  @Override
  public boolean supportsCorrelatedSubqueries() {
    return true;
  }
  @Override
  public boolean supportsUnion() {
    return true;
  }
  @Override
  public boolean supportsUnionAll() {
    return true;
  }

  // --- limits: 0 means unknown or unlimited ---

  @Override
  public int getMaxBinaryLiteralLength() {
    return 0;
  }
  @Override
  public int getMaxCharLiteralLength() {
    return 0;
  }
  @Override
  public int getMaxColumnNameLength() {
    return 0;
  }
  @Override
  public int getMaxColumnsInGroupBy() {
    return 0;
  }
  @Override
  public int getMaxColumnsInIndex() {
    return 0;
  }
  @Override
  public int getMaxColumnsInOrderBy() {
    return 0;
  }
  @Override
  public int getMaxColumnsInSelect() {
    return 0;
  }
  @Override
  public int getMaxColumnsInTable() {
    return 0;
  }
  @Override
  public int getMaxConnections() {
    return 0;
  }
  @Override
  public int getMaxCursorNameLength() {
    return 0;
  }
  @Override
  public int getMaxIndexLength() {
    return 0;
  }
  @Override
  public int getMaxSchemaNameLength() {
    return 0;
  }
  @Override
  public int getMaxProcedureNameLength() {
    return 0;
  }
  @Override
  public int getMaxCatalogNameLength() {
    return 0;
  }
  @Override
  public int getMaxRowSize() {
    return 0;
  }
  @Override
  public boolean doesMaxRowSizeIncludeBlobs() {
    return false;
  }
  @Override
  public int getMaxStatementLength() {
    return 0;
  }
  @Override
  public int getMaxStatements() {
    return 0;
  }
  @Override
  public int getMaxTableNameLength() {
    return 0;
  }
  @Override
  public int getMaxTablesInSelect() {
    return 0;
  }
  @Override
  public int getMaxUserNameLength() {
    return 0;
  }

  @Override
  public <T> T unwrap(Class<T> iface) throws SQLException {
    if (iface != null && iface.isInstance(this)) {
      return iface.cast(this);
    }
    throw new SQLException("No wrapper for " + iface);
  }

  @Override
  public boolean isWrapperFor(Class<?> iface) {
    return iface != null && iface.isInstance(this);
  }
}
