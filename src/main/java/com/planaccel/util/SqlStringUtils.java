package com.planaccel.util;

import io.trino.sql.SqlFormatter;
import io.trino.sql.parser.ParsingException;
import io.trino.sql.parser.ParsingOptions;
import io.trino.sql.parser.SqlParser;
import io.trino.sql.tree.Node;
import io.trino.sql.tree.Statement;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Utility methods for parsing and formatting SQL strings using the Trino parser.
 */
public final class SqlStringUtils {

    private static final Logger LOGGER = LogManager.getLogger(SqlStringUtils.class);

    private SqlStringUtils() {}

    private static final SqlParser SQL_PARSER = new SqlParser();

    // literals such as 10.5 stay exact decimals instead of being rejected
    private static final ParsingOptions PARSING_OPTIONS = new ParsingOptions(ParsingOptions.DecimalLiteralTreatment.AS_DECIMAL);

    /**
     * Parses a full SQL statement string into a Trino Statement AST node.
     * @throws RuntimeException wrapping the ParsingException if parsing fails.
     */
    public static Statement parseSqlStatement(String sql) {
        Objects.requireNonNull(sql, "SQL statement string cannot be null");
        try {
            return SQL_PARSER.createStatement(sql, PARSING_OPTIONS);
        } catch (ParsingException e) {
            LOGGER.debug("Failed to parse statement:\n{}", sql);
            throw new RuntimeException("SQL Statement Parsing Error: " + e.getMessage(), e);
        }
    }

    /**
     * Formats a Trino AST node back into SQL text. Falls back to {@code node.toString()}
     * when the formatter cannot handle the node.
     */
    public static String formatSql(Node node) {
        if (node == null) {
            return "NULL";
        }
        try {
            return SqlFormatter.formatSql(node);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to format node using SqlFormatter ({}), falling back to toString()", e.getMessage());
            return node.toString();
        }
    }
}
