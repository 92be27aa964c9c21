package com.mydetail.backend.modules.permission.infrastructure.jdbc;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.mydetail.backend.global.config.PermissionEngineProperties;
import com.mydetail.backend.modules.permission.application.BatchFacetRetriever;
import com.mydetail.backend.modules.permission.application.StorageFailures;
import com.mydetail.backend.modules.permission.domain.AggregationUnsupportedException;
import com.mydetail.backend.modules.permission.domain.PermissionErrorKind;
import com.mydetail.backend.modules.permission.domain.RoleFacets;
import com.mydetail.backend.modules.role.domain.ModuleCapabilityKey;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

/**
 * {@code fn_resolve_principal_facets(uuid)} 한 번 호출로 모든 역할의 facet 을 가져온다.
 * 함수가 없거나 결과 형태가 맞지 않으면 {@link AggregationUnsupportedException} 으로 폴백을 요청한다.
 */
@Component
public class JdbcBatchFacetRetriever implements BatchFacetRetriever {

    /** undefined_function, undefined_table, undefined_column, datatype_mismatch */
    private static final Set<String> STRUCTURAL_SQL_STATES = Set.of("42883", "42P01", "42703", "42804");

    private final JdbcTemplate jdbcTemplate;
    private final String sql;
    private final int queryTimeoutSeconds;

    public JdbcBatchFacetRetriever(JdbcTemplate jdbcTemplate, PermissionEngineProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.sql = """
                SELECT role_id, facet, module_key, capability_key
                  FROM %s(?)
                """.formatted(properties.batch().functionName());
        this.queryTimeoutSeconds = properties.fetch().storageTimeoutSeconds();
    }

    @Override
    public Map<Long, RoleFacets> retrieve(UUID principalId, Collection<Long> roleIds) {
        List<FacetRow> rows;
        try {
            rows = jdbcTemplate.query(connection -> {
                PreparedStatement statement = connection.prepareStatement(sql);
                statement.setQueryTimeout(queryTimeoutSeconds);
                statement.setObject(1, principalId);
                return statement;
            }, new FacetRowMapper());
        } catch (DataAccessException ex) {
            throw translate(ex);
        }
        return fold(rows, roleIds);
    }

    static Map<Long, RoleFacets> fold(List<FacetRow> rows, Collection<Long> roleIds) {
        Map<Long, Accumulator> byRole = new HashMap<>();
        for (Long roleId : roleIds) {
            byRole.put(roleId, new Accumulator());
        }
        for (FacetRow row : rows) {
            Accumulator accumulator = byRole.get(row.roleId());
            if (accumulator == null) {
                // 집계기와 함수 사이에 역할이 비활성화된 경우. 집계기 결과를 기준으로 삼는다.
                continue;
            }
            String facet = row.facet() == null ? "" : row.facet();
            switch (facet) {
                case "MODULE_ACCESS" -> accumulator.enabledModules.add(requireColumn(row.moduleKey(), "module_key", row));
                case "SYSTEM" -> accumulator.systemCapabilities.add(requireColumn(row.capabilityKey(), "capability_key", row));
                case "MODULE" -> accumulator.moduleCapabilities.add(new ModuleCapabilityKey(
                        requireColumn(row.moduleKey(), "module_key", row),
                        requireColumn(row.capabilityKey(), "capability_key", row)));
                default -> throw new AggregationUnsupportedException("unknown facet '" + row.facet() + "' returned by batch function", null);
            }
        }

        Map<Long, RoleFacets> result = new HashMap<>();
        byRole.forEach((roleId, accumulator) -> result.put(roleId, RoleFacets.of(
                roleId,
                accumulator.enabledModules,
                accumulator.systemCapabilities,
                accumulator.moduleCapabilities)));
        return result;
    }

    static AggregationUnsupportedException translate(DataAccessException ex) {
        if (ex instanceof BadSqlGrammarException || STRUCTURAL_SQL_STATES.contains(sqlState(ex))) {
            return new AggregationUnsupportedException("batch facet function unavailable", ex);
        }
        PermissionErrorKind kind = StorageFailures.classify(ex);
        return new AggregationUnsupportedException(
                kind == PermissionErrorKind.DEPENDENCY_UNAVAILABLE ? kind : PermissionErrorKind.UNEXPECTED,
                "batch facet retrieval failed", ex);
    }

    private static String sqlState(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof SQLException sqlException && sqlException.getSQLState() != null) {
                return sqlException.getSQLState();
            }
            current = current.getCause();
        }
        return null;
    }

    private static String requireColumn(String value, String column, FacetRow row) {
        if (value == null) {
            throw new AggregationUnsupportedException(column + " missing for " + row.facet() + " row of role " + row.roleId(), null);
        }
        return value;
    }

    record FacetRow(Long roleId, String facet, String moduleKey, String capabilityKey) {
    }

    static class FacetRowMapper implements RowMapper<FacetRow> {
        @Override
        public FacetRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new FacetRow(
                    rs.getLong("role_id"),
                    rs.getString("facet"),
                    rs.getString("module_key"),
                    rs.getString("capability_key")
            );
        }
    }

    private static final class Accumulator {
        private final Set<String> enabledModules = new HashSet<>();
        private final Set<String> systemCapabilities = new HashSet<>();
        private final List<ModuleCapabilityKey> moduleCapabilities = new ArrayList<>();
    }
}
