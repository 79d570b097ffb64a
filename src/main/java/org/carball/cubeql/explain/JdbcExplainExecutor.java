package org.carball.cubeql.explain;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.exception.ExplainException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ExplainExecutor} over a JDBC {@link DataSource}. Borrows a connection per call.
 */
@Slf4j
public class JdbcExplainExecutor implements ExplainExecutor {

    private final DataSource dataSource;

    public JdbcExplainExecutor(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Map<String, Object>> execute(String sql, List<Object> params) throws ExplainException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                statement.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = statement.executeQuery()) {
                ResultSetMetaData metaData = rs.getMetaData();
                int columnCount = metaData.getColumnCount();
                List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= columnCount; i++) {
                        row.put(metaData.getColumnLabel(i), rs.getObject(i));
                    }
                    rows.add(row);
                }
                log.debug("EXPLAIN returned {} rows", rows.size());
                return rows;
            }
        } catch (SQLException e) {
            throw new ExplainException("EXPLAIN failed: " + e.getMessage(), e);
        }
    }
}
