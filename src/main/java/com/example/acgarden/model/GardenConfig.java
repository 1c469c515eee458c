package com.example.acgarden.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Settings record stored in ~/.ac-garden/config.json.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GardenConfig {

    private Service atcoder = new Service();

    public static GardenConfig empty() {
        return new GardenConfig(new Service("", "", ""));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Service {

        @JsonProperty("repository_path")
        private String repositoryPath = "";

        @JsonProperty("user_id")
        private String userId = "";

        @JsonProperty("user_email")
        private String userEmail = "";
    }
}
