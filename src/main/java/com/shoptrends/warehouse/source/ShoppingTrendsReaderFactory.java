package com.shoptrends.warehouse.source;

import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Builds the record source for a shopping trends CSV file.
 * Each reader is single-use: it keeps no restart state.
 */
@Component
public class ShoppingTrendsReaderFactory {

    private static final int HEADER_LINES = 1;

    public FlatFileItemReader<FlatRecord> create(Resource resource) {
        ShoppingTrendsLineMapper lineMapper = new ShoppingTrendsLineMapper(HEADER_LINES);
        return new FlatFileItemReaderBuilder<FlatRecord>()
            .name("shoppingTrendsReader")
            .resource(resource)
            .encoding(StandardCharsets.UTF_8.name())
            .linesToSkip(HEADER_LINES)
            .skippedLinesCallback(lineMapper::readHeader)
            .lineMapper(lineMapper)
            .saveState(false)
            .strict(true)
            .build();
    }
}
