package com.surveyprep.surveyprep.processing;

import com.surveyprep.surveyprep.table.TableReader;
import com.surveyprep.surveyprep.table.TableWriter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Enables binding of survey processing properties and wires the table source and sink.
 */
@Configuration
@EnableConfigurationProperties(SurveyPrepProperties.class)
public class SurveyPrepConfig {

    @Bean
    public TableReader tableReader(SurveyPrepProperties properties) {
        return new TableReader(properties.getExcelHeaderRow());
    }

    @Bean
    public TableWriter tableWriter() {
        return new TableWriter();
    }
}
