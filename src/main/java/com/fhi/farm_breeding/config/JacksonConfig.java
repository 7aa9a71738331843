package com.fhi.farm_breeding.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig
{
   /**
    * Application-wide {@link ObjectMapper}, also used by the test fixture loader.
    * - JSON comments allowed (fixture files carry them)
    * - enum values accepted in any case ("male", "MALE")
    * - dates written as ISO strings
    */
    @Bean
    public ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .configure(JsonParser.Feature.ALLOW_COMMENTS, true)                       // // and /* */ comments in JSON
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)     // allows _comment fields etc.
                .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)                 // write "2025-07-15", not [2025,7,15]
                .addModule(new JavaTimeModule())                                         // java.time.* support
                .enable(SerializationFeature.INDENT_OUTPUT)                              // pretty print
                .build();
    }
}
