package com.tony.fantasyGolf.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.CollectionType;
import com.tony.fantasyGolf.config.RankingsProperties;
import com.tony.fantasyGolf.exception.RecordFetchException;
import com.tony.fantasyGolf.model.dto.FieldEntry;
import com.tony.fantasyGolf.model.dto.LiveGolfer;
import com.tony.fantasyGolf.model.dto.PlayerRanking;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;

@Service
@Slf4j
public class RankingsClient {

    static final String RANKINGS_PATH = "/preds/get-dg-rankings";
    static final String FIELD_PATH = "/field-updates";
    static final String LIVE_PATH = "/preds/in-play";

    private final RankingsProperties properties;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Autowired
    public RankingsClient(RankingsProperties properties, ObjectMapper objectMapper) {
        this(properties, new RestTemplate(), objectMapper);
    }

    RankingsClient(RankingsProperties properties, RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.properties = properties;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return properties.getApiKey() != null && !properties.getApiKey().isBlank();
    }

    public List<PlayerRanking> fetchRankings() {
        return fetchList(RANKINGS_PATH, "rankings", PlayerRanking.class);
    }

    public List<FieldEntry> fetchField() {
        return fetchList(FIELD_PATH, "field", FieldEntry.class);
    }

    // Scores en direct du tournoi de la semaine
    public List<LiveGolfer> fetchLiveGolfers() {
        return fetchList(LIVE_PATH, "data", LiveGolfer.class);
    }

    private <T> List<T> fetchList(String path, String arrayField, Class<T> type) {
        if (!isEnabled()) {
            throw new RecordFetchException("Clé API rankings absente (rankings.api-key)");
        }
        String url = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path(path)
                .queryParam("key", properties.getApiKey())
                .toUriString();
        try {
            String body = restTemplate.getForObject(url, String.class);
            if (body == null) {
                throw new RecordFetchException("Réponse vide pour " + path);
            }
            JsonNode array = objectMapper.readTree(body).path(arrayField);
            if (!array.isArray()) {
                throw new RecordFetchException("Champ '" + arrayField + "' absent de la réponse " + path);
            }
            CollectionType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, type);
            List<T> values = objectMapper.convertValue(array, listType);
            log.debug("📥 {} : {} lignes", path, values.size());
            return values;
        } catch (RestClientException e) {
            throw new RecordFetchException("Appel " + path + " en échec : " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new RecordFetchException("JSON illisible pour " + path, e);
        }
    }
}
