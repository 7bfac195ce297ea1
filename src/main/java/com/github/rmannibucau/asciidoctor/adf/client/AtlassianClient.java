package com.github.rmannibucau.asciidoctor.adf.client;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Jira and Confluence REST calls the macros need. Implementations never throw for remote failures,
 * they return a failed {@link ApiResult} or an empty optional.
 */
public interface AtlassianClient {

    /**
     * @param jql    the Jira query.
     * @param fields field ids to return, all the default ones when null.
     * @return the search response, it has an {@code issues} array.
     */
    ApiResult<JsonNode> queryIssues(String jql, List<String> fields);

    /**
     * @return the field definitions array ({@code id}, {@code name}, {@code custom}, {@code schema}).
     */
    ApiResult<JsonNode> getFieldMetadata();

    Optional<AtlassianUser> findUserByName(String fullName);
}
