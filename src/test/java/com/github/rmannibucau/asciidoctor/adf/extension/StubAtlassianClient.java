package com.github.rmannibucau.asciidoctor.adf.extension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.rmannibucau.asciidoctor.adf.client.ApiResult;
import com.github.rmannibucau.asciidoctor.adf.client.AtlassianClient;
import com.github.rmannibucau.asciidoctor.adf.client.AtlassianUser;

class StubAtlassianClient implements AtlassianClient {

    final List<String> queries = new ArrayList<>();

    final List<List<String>> queriedFields = new ArrayList<>();

    final List<JiraCredentials> credentials = new ArrayList<>();

    final Map<String, AtlassianUser> users = new HashMap<>();

    ApiResult<JsonNode> issues = ApiResult.failure("no issues configured");

    ApiResult<JsonNode> fields = ApiResult.failure("no fields configured");

    void reset() {
        queries.clear();
        queriedFields.clear();
        credentials.clear();
        users.clear();
        issues = ApiResult.failure("no issues configured");
        fields = ApiResult.failure("no fields configured");
    }

    StubAtlassianClient bind(final JiraCredentials credentials) {
        this.credentials.add(credentials);
        return this;
    }

    @Override
    public ApiResult<JsonNode> queryIssues(final String jql, final List<String> fields) {
        queries.add(jql);
        queriedFields.add(fields);
        return issues;
    }

    @Override
    public ApiResult<JsonNode> getFieldMetadata() {
        return fields;
    }

    @Override
    public Optional<AtlassianUser> findUserByName(final String fullName) {
        return Optional.ofNullable(users.get(fullName));
    }
}
