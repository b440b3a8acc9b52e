package com.grokpm.backend.modules.admin.application;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.jdbc.datasource.init.ScriptException;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.sql.DataSource;

import com.grokpm.backend.modules.property.infrastructure.persistence.PropertyRepository;

/**
 * Loads the sample data set into an empty database.
 *
 * <p>The script runs on the connection bound to the current transaction, so a failing statement leaves no partial
 * data behind.</p>
 */
@Service
public class SampleDataService {

    private static final Logger log = LoggerFactory.getLogger(SampleDataService.class);

    static final String SAMPLE_DATA_SCRIPT = "db/seed/sample_data.sql";

    private final DataSource dataSource;
    private final PropertyRepository propertyRepository;

    public SampleDataService(@NonNull DataSource dataSource, PropertyRepository propertyRepository) {
        this.dataSource = dataSource;
        this.propertyRepository = propertyRepository;
    }

    /**
     * @return {@code true} when the script ran, {@code false} when properties already exist
     */
    @Transactional
    public boolean seedIfEmpty() {
        long existing = propertyRepository.count();
        if (existing > 0) {
            log.info("Skipping sample data: {} propert{} already present", existing, existing == 1 ? "y" : "ies");
            return false;
        }

        Resource resource = new ClassPathResource(SAMPLE_DATA_SCRIPT);
        Connection connection = DataSourceUtils.getConnection(dataSource);
        try {
            ScriptUtils.executeSqlScript(connection, new EncodedResource(resource, StandardCharsets.UTF_8));
            log.info("Sample data script {} executed successfully", SAMPLE_DATA_SCRIPT);
            return true;
        } catch (ScriptException ex) {
            Throwable root = ex;
            while (root.getCause() != null) {
                root = root.getCause();
            }
            log.error("Failed to execute sample data script", ex);
            throw new IllegalStateException("Failed to execute sample data script: " + root.getMessage(), ex);
        } finally {
            DataSourceUtils.releaseConnection(connection, dataSource);
        }
    }
}
