package com.formulatrace.app.config;

import com.formulatrace.app.datasource.InMemoryWorkbookDataSource;
import com.formulatrace.app.datasource.WorkbookDataSource;
import com.formulatrace.app.models.Workbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the in-memory workbook and the data source the tracer reads from.
 */
@Configuration
public class WorkbookConfig {

    private static final Logger log = LoggerFactory.getLogger(WorkbookConfig.class);

    @Bean
    public Workbook workbook() {
        return new Workbook();
    }

    @Bean
    public WorkbookDataSource workbookDataSource(Workbook workbook, TraceProperties properties) {
        log.info("In-memory workbook data source (host index {})",
                properties.isHostIndexEnabled() ? "enabled" : "disabled");
        return new InMemoryWorkbookDataSource(workbook, properties.isHostIndexEnabled());
    }
}
