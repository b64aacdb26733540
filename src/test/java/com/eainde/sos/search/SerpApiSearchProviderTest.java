package com.eainde.sos.search;

import com.eainde.sos.config.SosProperties;
import com.eainde.sos.model.SearchSnippet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SerpApiSearchProviderTest {

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private SosProperties.Search properties;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new SosProperties.Search();
        properties.setApiKey("test-key");
    }

    @Test
    void mapsOrganicResults() {
        server.expect(requestTo(startsWith("https://serpapi.com/search.json")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("api_key", "test-key"))
                .andExpect(queryParam("num", "10"))
                .andExpect(queryParam("hl", "en"))
                .andRespond(withSuccess("""
                        {
                          "search_metadata": {"status": "Success"},
                          "organic_results": [
                            {"position": 1, "title": "ERSS 112", "snippet": "Dial 112", "link": "https://112.gov.in/"},
                            {"position": 2, "title": "Tele-MANAS", "link": "https://telemanas.mohfw.gov.in/"}
                          ]
                        }
                        """, MediaType.APPLICATION_JSON));

        List<SearchSnippet> snippets = new SerpApiSearchProvider(restTemplate, properties).search("India emergency 2025");

        server.verify();
        assertThat(snippets).containsExactly(
                new SearchSnippet("ERSS 112", "Dial 112", "https://112.gov.in/"),
                new SearchSnippet("Tele-MANAS", "", "https://telemanas.mohfw.gov.in/"));
    }

    @Test
    void missingOrganicResultsGivesEmptyList() {
        server.expect(requestTo(startsWith("https://serpapi.com/search.json")))
                .andRespond(withSuccess("{\"search_metadata\": {}}", MediaType.APPLICATION_JSON));

        assertThat(new SerpApiSearchProvider(restTemplate, properties).search("Atlantis")).isEmpty();
    }

    @Test
    void blankApiKeySkipsTheCall() {
        properties.setApiKey(" ");

        assertThat(new SerpApiSearchProvider(restTemplate, properties).search("India")).isEmpty();
        server.verify();
    }

    @Test
    void serverErrorPropagates() {
        server.expect(requestTo(startsWith("https://serpapi.com/search.json")))
                .andRespond(withServerError());

        assertThatThrownBy(() -> new SerpApiSearchProvider(restTemplate, properties).search("India"))
                .isInstanceOf(HttpServerErrorException.class);
    }
}
