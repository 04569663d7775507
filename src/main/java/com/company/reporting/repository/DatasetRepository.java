package com.company.reporting.repository;

import com.company.reporting.domain.Dataset;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class DatasetRepository {

    private final JdbcTemplate jdbcTemplate;

    public Optional<Dataset> findById(Long datasetId) {
        String sql = "SELECT id, name, table_name, status FROM datasets WHERE id = ?";

        List<Dataset> results = jdbcTemplate.query(sql, new DatasetRowMapper(), datasetId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private static class DatasetRowMapper implements RowMapper<Dataset> {
        @Override
        public Dataset mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Dataset.builder()
                    .id(rs.getLong("id"))
                    .name(rs.getString("name"))
                    .tableName(rs.getString("table_name"))
                    .status(rs.getString("status"))
                    .build();
        }
    }
}
