package com.example.dataflow.config;

import com.example.dataflow.core.RecordIngestor;
import com.example.dataflow.core.RefreshPipeline;
import com.example.dataflow.core.SourcePreviewer;
import com.example.dataflow.core.processor.PayloadNormalizer;
import com.example.dataflow.core.processor.RowValidator;
import com.example.dataflow.core.processor.TypeCoercer;
import com.example.dataflow.core.reader.HttpSourceFetcher;
import com.example.dataflow.core.reader.JsonRecordDecoder;
import com.example.dataflow.core.writer.JdbcRowWriter;
import com.example.dataflow.repository.JdbcRefreshLogRepository;
import com.example.dataflow.repository.JdbcTableMetadataRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.net.http.HttpClient;

/**
 * Wires the refresh pipeline. One {@link RefreshPipeline} instance serves both the scheduler
 * and the manual trigger endpoint; preview and ingest reuse its stages.
 */
@Configuration
public class EtlUtilConfig {

    @Bean
    public TypeCoercer typeCoercer(ObjectMapper objectMapper) {
        return new TypeCoercer(objectMapper);
    }

    @Bean
    public PayloadNormalizer payloadNormalizer() {
        return new PayloadNormalizer();
    }

    @Bean
    public JdbcTableMetadataRepository tableMetadataRepository(JdbcTemplate jdbcTemplate, DataflowProperties properties) {
        DataflowProperties.Metadata metadata = properties.getMetadata();
        return new JdbcTableMetadataRepository(jdbcTemplate, metadata.getSchema(), metadata.getPeriodicTableType());
    }

    @Bean
    public JdbcRefreshLogRepository refreshLogRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcRefreshLogRepository(jdbcTemplate);
    }

    @Bean
    public RowValidator rowValidator(JdbcTableMetadataRepository tableMetadataRepository, TypeCoercer typeCoercer) {
        return new RowValidator(tableMetadataRepository, typeCoercer);
    }

    @Bean
    public HttpClient sourceHttpClient(DataflowProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getFetch().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public HttpSourceFetcher sourceFetcher(HttpClient sourceHttpClient, ObjectMapper objectMapper,
                                           DataflowProperties properties) {
        DataflowProperties.Fetch fetch = properties.getFetch();
        return new HttpSourceFetcher(sourceHttpClient, objectMapper,
                                     fetch.getRequestTimeout(), fetch.getMaxErrorBodyBytes());
    }

    @Bean
    public JdbcRowWriter rowWriter(DataSource dataSource) {
        return new JdbcRowWriter(dataSource);
    }

    @Bean
    public RefreshPipeline refreshPipeline(JdbcTableMetadataRepository tableMetadataRepository,
                                           JdbcRefreshLogRepository refreshLogRepository,
                                           HttpSourceFetcher sourceFetcher,
                                           PayloadNormalizer payloadNormalizer,
                                           RowValidator rowValidator,
                                           JdbcRowWriter rowWriter) {
        return new RefreshPipeline(tableMetadataRepository, tableMetadataRepository, refreshLogRepository,
                                   sourceFetcher, payloadNormalizer, rowValidator, rowWriter);
    }

    @Bean
    public JsonRecordDecoder jsonRecordDecoder(ObjectMapper objectMapper) {
        return new JsonRecordDecoder(objectMapper);
    }

    @Bean
    public SourcePreviewer sourcePreviewer(HttpSourceFetcher sourceFetcher) {
        return new SourcePreviewer(sourceFetcher);
    }

    @Bean
    public RecordIngestor recordIngestor(JdbcTableMetadataRepository tableMetadataRepository,
                                         JsonRecordDecoder jsonRecordDecoder,
                                         PayloadNormalizer payloadNormalizer,
                                         RowValidator rowValidator,
                                         JdbcRowWriter rowWriter) {
        return new RecordIngestor(tableMetadataRepository, jsonRecordDecoder, payloadNormalizer, rowValidator, rowWriter);
    }
}
