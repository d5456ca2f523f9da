package com.skillforge.engine.api;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class ApiKeyFilterTest {

    @Test
    void blankKey_letsEverythingThrough() throws Exception {
        MockHttpServletResponse response = run(new ApiKeyFilter(""), "/api/v1/jobs", null);

        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    void configuredKey_rejectsMissingOrWrongHeader() throws Exception {
        ApiKeyFilter filter = new ApiKeyFilter("s3cret");

        assertThat(run(filter, "/api/v1/jobs", null).getStatus()).isEqualTo(401);
        assertThat(run(filter, "/api/v1/jobs", "guess").getStatus()).isEqualTo(401);
        assertThat(run(filter, "/api/v1/jobs", "s3cret").getStatus()).isEqualTo(200);
    }

    @Test
    void configuredKey_leavesActuatorOpen() throws Exception {
        assertThat(run(new ApiKeyFilter("s3cret"), "/actuator/health", null).getStatus()).isEqualTo(200);
    }

    private static MockHttpServletResponse run(ApiKeyFilter filter, String uri, String key) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", uri);
        if (key != null) request.addHeader(ApiKeyFilter.HEADER, key);
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }
}
