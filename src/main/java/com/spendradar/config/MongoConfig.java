package com.spendradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.List;

/**
 * {@code Transaction.amount} is a BigDecimal and is stored as Decimal128 rather than Spring Data's default
 * string form, so amounts written by the import layer read back with their scale. Indexes come from
 * {@code @Indexed}/{@code @CompoundIndex} on the documents (spring.data.mongodb.auto-index-creation).
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(List.of(
                new BigDecimalToDecimal128Converter(),
                new Decimal128ToBigDecimalConverter()
        ));
    }
}
