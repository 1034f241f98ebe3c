package com.matchmate.backend.modules.system;

import static org.hamcrest.Matchers.hasItems;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.matchmate.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class StatusIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void rootBannerIsPublic() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Matchmate API running"));
    }

    @Test
    void diagnosticsReportConnectedDatabaseAndMigratedTables() throws Exception {
        mockMvc.perform(get("/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.backend").value("running"))
                .andExpect(jsonPath("$.database").value("UP"))
                .andExpect(jsonPath("$.database_url").isString())
                .andExpect(jsonPath("$.database_name").value("matchmate_test"))
                .andExpect(jsonPath("$.connection_status").value("Connected"))
                .andExpect(jsonPath("$.tables", hasItems("app_user", "user_session", "swipe", "user_match")));
    }
}
