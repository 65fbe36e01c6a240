package com.sgr.runtime.tools;

import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Standard tools any role can reference by id with {@code provider: builtin}.
 * Failures are thrown, never returned as text, so the executor records them.
 */
@Component
public class FunctionTools implements BuiltinToolSet {

    private static final Logger log = LoggerFactory.getLogger(FunctionTools.class);

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int MAX_BODY_CHARS = 1000;

    private final RestClient restClient;

    public FunctionTools(RestClient.Builder restClientBuilder) {
        this.restClient = restClientBuilder.build();
    }

    @Tool(name = "get_date_time", value = "Returns the current system date and time")
    public String getDateTime() {
        return LocalDateTime.now().format(DATE_TIME);
    }

    @Tool(name = "search_knowledge_base", value = "Searches the local knowledge base")
    public String searchKnowledgeBase(@P("The search query") String query) {
        // no knowledge base is wired in yet, answer like an empty index
        return "Search result for '" + query + "': No specific entries found in local KB. "
                + "Please try a different query or use web search.";
    }

    @Tool(name = "http_request", value = "Performs a simple HTTP GET or POST request and returns the start of the response body")
    public String httpRequest(@P("Absolute URL to call") String url,
            @P(value = "HTTP method, GET or POST", required = false) String method,
            @P(value = "JSON body for POST requests", required = false) String data) {
        String verb = StringUtils.hasText(method) ? method.toUpperCase(Locale.ROOT) : "GET";
        String body;
        if ("GET".equals(verb)) {
            body = restClient.method(HttpMethod.GET).uri(url).retrieve().body(String.class);
        } else if ("POST".equals(verb)) {
            body = restClient.method(HttpMethod.POST).uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(data == null ? "{}" : data)
                    .retrieve()
                    .body(String.class);
        } else {
            throw new IllegalArgumentException("Unsupported HTTP method '" + method + "'");
        }
        log.debug("HTTP {} {} returned {} chars", verb, url, body == null ? 0 : body.length());
        if (body == null) {
            return "";
        }
        return body.length() > MAX_BODY_CHARS ? body.substring(0, MAX_BODY_CHARS) : body;
    }
}
