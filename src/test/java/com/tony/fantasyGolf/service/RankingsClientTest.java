package com.tony.fantasyGolf.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.fantasyGolf.config.RankingsProperties;
import com.tony.fantasyGolf.exception.RecordFetchException;
import com.tony.fantasyGolf.model.dto.FieldEntry;
import com.tony.fantasyGolf.model.dto.LiveGolfer;
import com.tony.fantasyGolf.model.dto.PlayerRanking;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RankingsClientTest {

    private RankingsProperties properties;
    private MockRestServiceServer server;
    private RankingsClient client;

    @BeforeEach
    void setUp() {
        properties = new RankingsProperties();
        properties.setBaseUrl("https://feeds.example.test");
        properties.setApiKey("secret");

        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RankingsClient(properties, restTemplate, new ObjectMapper());
    }

    @Test
    void shouldParseRankings() {
        server.expect(requestTo("https://feeds.example.test/preds/get-dg-rankings?key=secret"))
                .andRespond(withSuccess("""
                        {"last_updated": "2025-04-07", "rankings": [
                          {"dg_id": 18417, "player_name": "Scheffler, Scottie", "datagolf_rank": 1,
                           "owgr_rank": 1, "dg_skill_estimate": 3.1, "country": "USA", "am": 0}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<PlayerRanking> rankings = client.fetchRankings();

        assertThat(rankings).containsExactly(new PlayerRanking(18417, "Scheffler, Scottie", 1, 1, 3.1, "USA"));
        server.verify();
    }

    @Test
    void shouldParseField() {
        server.expect(requestTo("https://feeds.example.test/field-updates?key=secret"))
                .andRespond(withSuccess("""
                        {"event_name": "Masters", "field": [
                          {"dg_id": 1, "player_name": "McIlroy, Rory", "country": "NIR"},
                          {"dg_id": 2, "player_name": "Lowry, Shane", "country": "IRL"}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<FieldEntry> field = client.fetchField();

        assertThat(field).extracting(FieldEntry::apiId).containsExactly(1, 2);
    }

    @Test
    void shouldParseLiveGolfers() {
        server.expect(requestTo("https://feeds.example.test/preds/in-play?key=secret"))
                .andRespond(withSuccess("""
                        {"info": {"current_round": 2, "event_name": "Masters"}, "data": [
                          {"dg_id": 18417, "player_name": "Scheffler, Scottie", "current_pos": "T1",
                           "current_score": -6, "today": -3, "thru": 12, "round": 2,
                           "R1": 69, "R2": null, "R3": null, "R4": null, "win": 0.41, "make_cut": 1.0}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<LiveGolfer> live = client.fetchLiveGolfers();

        assertThat(live).containsExactly(
                new LiveGolfer(18417, "Scheffler, Scottie", "T1", -6, -3, 12, 2, 69, null, null, null));
        assertThat(live.get(0).isOnCourse()).isTrue();
        server.verify();
    }

    @Test
    void serverErrorShouldBecomeRecordFetchException() {
        server.expect(requestTo("https://feeds.example.test/field-updates?key=secret"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchField()).isInstanceOf(RecordFetchException.class);
    }

    @Test
    void missingArrayShouldBeRejected() {
        server.expect(requestTo("https://feeds.example.test/preds/get-dg-rankings?key=secret"))
                .andRespond(withSuccess("{\"error\": \"quota\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchRankings())
                .isInstanceOf(RecordFetchException.class)
                .hasMessageContaining("rankings");
    }

    @Test
    void missingApiKeyShouldFailWithoutCallingTheProvider() {
        properties.setApiKey("");

        assertThat(client.isEnabled()).isFalse();
        assertThatThrownBy(() -> client.fetchField()).isInstanceOf(RecordFetchException.class);
        server.verify();
    }
}
