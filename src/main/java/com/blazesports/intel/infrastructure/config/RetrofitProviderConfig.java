package com.blazesports.intel.infrastructure.config;

import com.blazesports.intel.infrastructure.adapter.provider.SportsDataApi;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;

@Configuration
public class RetrofitProviderConfig {

    @Bean
    public SportsDataApi sportsDataApi(@Value("${blaze.origin.base-url}") String baseUrl, ObjectMapper objectMapper) {
        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/")
                .addConverterFactory(JacksonConverterFactory.create(objectMapper))
                .build();

        return retrofit.create(SportsDataApi.class);
    }
}
