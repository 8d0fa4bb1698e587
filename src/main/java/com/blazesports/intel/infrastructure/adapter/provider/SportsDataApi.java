package com.blazesports.intel.infrastructure.adapter.provider;

import com.fasterxml.jackson.databind.JsonNode;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Path;

public interface SportsDataApi {

    @GET("{path}")
    Call<JsonNode> fetch(@Path(value = "path", encoded = true) String path);
}
