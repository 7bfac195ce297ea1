package com.github.rmannibucau.asciidoctor.adf.extension;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.asciidoctor.Asciidoctor;
import org.asciidoctor.Options;
import org.asciidoctor.SafeMode;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.rmannibucau.asciidoctor.adf.AdfConverter;
import com.github.rmannibucau.asciidoctor.adf.client.ApiResult;
import com.github.rmannibucau.asciidoctor.adf.client.AtlassianUser;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

class JiraMacrosTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String CREDENTIALS = ":atlassian-base-url: https://acme.atlassian.net\n"
            + ":confluence-api-token: token\n"
            + ":confluence-user-email: me@acme.com\n";

    private static final StubAtlassianClient CLIENT = new StubAtlassianClient();

    private static Asciidoctor asciidoctor;

    @BeforeAll
    static void start() {
        asciidoctor = Asciidoctor.Factory.create();
        asciidoctor.unregisterAllExtensions();
        new AdfExtensionRegistry(new ConfigResolver(Map.of(), name -> null), CLIENT::bind).register(asciidoctor);
    }

    @AfterAll
    static void stop() {
        asciidoctor.close();
    }

    @BeforeEach
    void resetClient() {
        CLIENT.reset();
    }

    private static String convert(final String adoc, final String backend) {
        return asciidoctor.convert(adoc, Options.builder().backend(backend).safe(SafeMode.SAFE).build());
    }

    private static JsonNode adf(final String adoc) {
        try {
            return MAPPER.readTree(convert(adoc, AdfConverter.BACKEND));
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    @Nested
    class JiraLink {

        @Test
        void linkToIssue() {
            final JsonNode content = adf(":jira-base-url: https://jira.acme.com\n\nSee jira:DEMO-1[] and jira:DEMO-2[the bug].")
                    .at("/content/0/content");
            assertThat(content.get(1).path("text").asText()).isEqualTo("DEMO-1");
            assertThat(content.get(1).at("/marks/0/attrs/href").asText()).isEqualTo("https://jira.acme.com/browse/DEMO-1");
            assertThat(content.get(3).path("text").asText()).isEqualTo("the bug");
            assertThat(content.get(3).at("/marks/0/attrs/href").asText()).isEqualTo("https://jira.acme.com/browse/DEMO-2");
        }

        @Test
        void unifiedBaseUrl() {
            final JsonNode link = adf(":atlassian-base-url: https://acme.atlassian.net/\n\njira:DEMO-1[]").at("/content/0/content/0");
            assertThat(link.at("/marks/0/attrs/href").asText()).isEqualTo("https://acme.atlassian.net/browse/DEMO-1");
        }

        @Test
        @DisplayName("without base URL the invocation is kept as text")
        void missingBaseUrl() {
            final String html = convert("jira:ISSUE-123[]\n\njira:ISSUE-456[Custom link text]", "html5");
            assertThat(html).contains("jira:ISSUE-123[]").contains("jira:ISSUE-456[Custom link text]");
        }
    }

    @Nested
    class Mention {

        @Test
        void userFound() {
            CLIENT.users.put("John Doe", new AtlassianUser("abc-123", "John Doe"));
            final JsonNode mention = adf(CREDENTIALS + "\nHello atlasMention:John_Doe[]").at("/content/0/content/1");
            assertThat(mention.path("type").asText()).isEqualTo("mention");
            assertThat(mention.at("/attrs/id").asText()).isEqualTo("abc-123");
            assertThat(mention.at("/attrs/text").asText()).isEqualTo("@John Doe");
            assertThat(CLIENT.credentials).hasSize(1);
            assertThat(CLIENT.credentials.get(0).getConfluenceBaseUrl()).isEqualTo("https://acme.atlassian.net");
        }

        @Test
        void userNotFound() {
            final JsonNode content = adf(CREDENTIALS + "\natlasMention:Jane_Roe[]").at("/content/0/content");
            assertThat(content.findValuesAsText("text")).containsExactly("@Jane Roe");
        }

        @Test
        void missingCredentials() {
            final JsonNode content = adf("atlasMention:John_Doe[]").at("/content/0/content");
            assertThat(content.findValuesAsText("text")).containsExactly("@John Doe");
            assertThat(CLIENT.credentials).isEmpty();
        }

        @Test
        @DisplayName("other backends only get the name")
        void html() {
            assertThat(convert(CREDENTIALS + "\natlasMention:John_Doe[]", "html5")).contains("@John Doe");
            assertThat(CLIENT.credentials).isEmpty();
        }

        @Test
        @DisplayName("mentions inside AsciiDoc table cells are resolved too")
        void inTableCell() {
            CLIENT.users.put("John Doe", new AtlassianUser("abc-123", "John Doe"));
            final JsonNode cell = adf(CREDENTIALS + "\n|===\na|Owner: atlasMention:John_Doe[]\n|===").at("/content/0/content/0/content/0");
            assertThat(cell.at("/content/0/content").findValuesAsText("type")).containsExactly("text", "mention");
        }
    }

    @Nested
    class IssuesTable {

        private final ListAppender<ILoggingEvent> logs = new ListAppender<>();

        @BeforeEach
        void captureLogs() throws JsonProcessingException {
            logs.start();
            ((Logger) LoggerFactory.getLogger(JiraIssuesTableBlockMacro.class)).addAppender(logs);
            CLIENT.fields = JiraFieldResolverTest.metadata();
        }

        @AfterEach
        void releaseLogs() {
            ((Logger) LoggerFactory.getLogger(JiraIssuesTableBlockMacro.class)).detachAppender(logs);
        }

        @Test
        void table() throws JsonProcessingException {
            CLIENT.issues = ApiResult.success(MAPPER.readTree("{\"issues\":[{\"key\":\"DEMO-1\",\"fields\":{"
                    + "\"summary\":\"First\",\"status\":{\"name\":\"Done\",\"statusCategory\":{\"name\":\"Complete\"}},"
                    + "\"customfield_10001\":5}}]}"));

            final JsonNode doc = adf(CREDENTIALS + "\njiraIssuesTable::['project = DEMO', fields='key,summary,status,Story Points', title='Backlog']");

            assertThat(CLIENT.queries).containsExactly("project = DEMO");
            assertThat(CLIENT.queriedFields).containsExactly(List.of("key", "summary", "status", "customfield_10001"));

            assertThat(doc.at("/content/0/content/0/text").asText()).isEqualTo("Backlog");
            assertThat(doc.at("/content/0/content/0/marks/0/type").asText()).isEqualTo("strong");
            final JsonNode table = doc.at("/content/1");
            assertThat(table.path("type").asText()).isEqualTo("table");
            assertThat(table.at("/content/0/content").findValuesAsText("text"))
                    .containsExactly("Key", "Summary", "Status", "Story  Points");
            final JsonNode row = table.at("/content/1");
            assertThat(row.at("/content/0/content/0/content/0/text").asText()).isEqualTo("DEMO-1");
            assertThat(row.at("/content/0/content/0/content/0/marks/0/attrs/href").asText())
                    .isEqualTo("https://acme.atlassian.net/browse/DEMO-1");
            assertThat(row.at("/content/2/content/0/content/0/text").asText()).isEqualTo("Done (Complete)");
            assertThat(row.at("/content/3/content/0/content/0/text").asText()).isEqualTo("5");
        }

        @Test
        void defaultFields() throws JsonProcessingException {
            CLIENT.issues = ApiResult.success(MAPPER.readTree("{\"issues\":[]}"));
            adf(CREDENTIALS + "\njiraIssuesTable::['project = DEMO']");
            assertThat(CLIENT.queriedFields).containsExactly(List.of("key", "summary", "status"));
        }

        @Test
        void invalidAttributes() {
            final JsonNode paragraph = adf(CREDENTIALS + "\njiraIssuesTable::['project = DEMO', color=red]").at("/content/0");
            assertThat(paragraph.at("/content/0/text").asText())
                    .isEqualTo("jiraIssuesTable::['project = DEMO', fields='INVALID ATTRIBUTES']");
            assertThat(CLIENT.queries).isEmpty();
        }

        @Test
        void missingCredentials() {
            final JsonNode paragraph = adf("jiraIssuesTable::['project = DEMO', fields='key']").at("/content/0");
            assertThat(paragraph.at("/content/0/text").asText()).isEqualTo("jiraIssuesTable::['project = DEMO', fields='key']");
            assertThat(CLIENT.credentials).isEmpty();
        }

        @Test
        void missingJql() {
            final JsonNode paragraph = adf(CREDENTIALS + "\njiraIssuesTable::[fields='key']").at("/content/0");
            assertThat(paragraph.at("/content/0/text").asText()).isEqualTo("jiraIssuesTable::['', fields='key']");
        }

        @Test
        void failedQuery() {
            CLIENT.issues = ApiResult.failure("HTTP 400");
            final JsonNode paragraph = adf(CREDENTIALS + "\njiraIssuesTable::['project = DEMO', fields='key']").at("/content/0");
            assertThat(paragraph.at("/content/0/text").asText()).isEqualTo("jiraIssuesTable::['project = DEMO', fields='key']");
            assertThat(logs.list).extracting(ILoggingEvent::getFormattedMessage)
                    .contains("Jira API query failed or returned no issues: HTTP 400");
        }

        @Test
        @DisplayName("unknown fields log the field reference once per document")
        void unknownFields() {
            final JsonNode doc = adf(CREDENTIALS
                    + "\njiraIssuesTable::['project = DEMO', fields='key,Nope']\n\njiraIssuesTable::['project = DEMO', fields='Other']");

            assertThat(doc.at("/content/0/content/0/text").asText()).isEqualTo("jiraIssuesTable::['project = DEMO', fields='key,Nope']");
            assertThat(CLIENT.queries).isEmpty();
            assertThat(logs.list).extracting(ILoggingEvent::getFormattedMessage)
                    .filteredOn("JIRA FIELD REFERENCE:"::equals)
                    .hasSize(1);
            assertThat(logs.list).extracting(ILoggingEvent::getFormattedMessage)
                    .anyMatch(m -> m.startsWith("customfield_10001") && m.contains("\"Story  Points\"") && m.contains("[number]"))
                    .contains("Unknown Jira field name(s): \"Nope\". Use an exact field name as shown above or the custom field id (e.g. customfield_12345).");
        }
    }
}
