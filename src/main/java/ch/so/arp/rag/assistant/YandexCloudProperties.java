package ch.so.arp.rag.assistant;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.StringUtils;

/**
 * Connection settings for the Yandex Foundation Models API.
 *
 * @param apiKey         key sent as {@code Authorization: Api-Key ...}
 * @param folderId       cloud folder owning the models
 * @param baseUrl        API root, the clients append {@code /textEmbedding} and {@code /completion}
 * @param embedModel     embedding model name
 * @param chatModel      completion model name
 * @param embedDimension dimension assumed until the first embedding response arrives
 * @param maxEmbedChars  longer embedding inputs are cut to this many characters
 */
@ConfigurationProperties(prefix = "rag.yandex")
public record YandexCloudProperties(
        String apiKey,
        String folderId,
        @DefaultValue("https://llm.api.cloud.yandex.net/foundationModels/v1") String baseUrl,
        @DefaultValue("text-search-doc") String embedModel,
        @DefaultValue("yandexgpt-lite") String chatModel,
        @DefaultValue("256") int embedDimension,
        @DefaultValue("10000") int maxEmbedChars) {

    /**
     * Fails fast when credentials are absent.
     *
     * @throws ConfigurationException if the API key or the folder id is blank
     */
    public void requireCredentials() {
        if (!StringUtils.hasText(apiKey)) {
            throw new ConfigurationException(
                    "Property 'rag.yandex.api-key' (YANDEX_API_KEY) must be provided when mocks are disabled");
        }
        if (!StringUtils.hasText(folderId)) {
            throw new ConfigurationException(
                    "Property 'rag.yandex.folder-id' (YANDEX_FOLDER_ID) must be provided when mocks are disabled");
        }
    }

    public String embedModelUri() {
        return "emb://" + folderId + "/" + embedModel;
    }

    public String chatModelUri() {
        return "gpt://" + folderId + "/" + chatModel;
    }
}
