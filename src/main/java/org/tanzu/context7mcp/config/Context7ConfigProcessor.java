package org.tanzu.context7mcp.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

/**
 * Processor for the effective Context7 configuration and Cloud Foundry service bindings.
 * 
 * At startup this component logs the loaded configuration (secrets masked) and,
 * when the catalog credentials are incomplete, looks for a service binding in the
 * VCAP_SERVICES environment variable whose name contains "context7". Values from
 * the binding only fill settings that are missing or still hold a placeholder;
 * explicitly configured values are never overridden.
 * 
 * Configuration priority (highest to lowest):
 * 1. Environment variables / application.properties
 * 2. Cloud Foundry service binding (VCAP_SERVICES)
 * 3. Default values
 */
@Component
public class Context7ConfigProcessor {

    private static final Logger logger = LoggerFactory.getLogger(Context7ConfigProcessor.class);

    /** The Context7 configuration object to be updated */
    @Autowired
    private Context7Config context7Config;

    /** Spring environment for accessing environment variables */
    @Autowired
    private Environment environment;

    /**
     * Logs the loaded configuration and fills missing credentials from VCAP_SERVICES.
     */
    @PostConstruct
    public void processVCapServices() {
        logger.info("Loaded Context7 configuration: {}", context7Config);

        if (context7Config.getMinimumTokens() > context7Config.getDefaultTokens()) {
            logger.warn("Minimum token budget {} exceeds the default budget {}; requests will use the minimum",
                       context7Config.getMinimumTokens(), context7Config.getDefaultTokens());
        }

        applyServiceBinding();

        // Checked last so a key supplied by the service binding counts
        if (!isValid(context7Config.getClientIpEncryptionKey())) {
            logger.warn("No client IP encryption key configured (CLIENT_IP_ENCRYPTION_KEY); "
                       + "requests carrying a caller address will fail");
        }
    }

    /**
     * Fills missing catalog credentials from a VCAP_SERVICES binding.
     * 
     * Does nothing when the API key and base URL are already configured, when
     * VCAP_SERVICES is absent, or when no Context7 service is bound. Parsing
     * errors are logged and leave the configuration untouched.
     */
    private void applyServiceBinding() {
        if (isConfigurationComplete()) {
            logger.info("Context7 configuration is complete from environment variables");
            return;
        }

        String vcapServices = environment.getProperty("VCAP_SERVICES");
        logger.info("VCAP_SERVICES available: {}", vcapServices != null && !vcapServices.isEmpty());

        if (vcapServices == null || vcapServices.isEmpty()) {
            logger.warn("VCAP_SERVICES not available; catalog calls will be sent without an API key");
            return;
        }

        try {
            ObjectMapper mapper = new ObjectMapper();
            JsonNode vcapServicesNode = mapper.readTree(vcapServices);

            JsonNode credentials = findContext7Credentials(vcapServicesNode);
            if (credentials != null) {
                updateConfigurationFromVCap(credentials);
                logger.info("Context7 configuration updated from VCAP_SERVICES: {}", context7Config);
            } else {
                logger.warn("No Context7 service found in VCAP_SERVICES");
            }
        } catch (Exception e) {
            logger.error("Error processing VCAP_SERVICES: {}", e.getMessage(), e);
        }
    }

    /**
     * Checks whether the API key and base URL are both set to real values.
     * 
     * A value is valid if it is not null, not blank and not an unresolved
     * placeholder (${...}).
     * 
     * @return true if the configuration is complete, false otherwise
     */
    private boolean isConfigurationComplete() {
        boolean apiKeyValid = isValid(context7Config.getApiKey());
        boolean baseUrlValid = isValid(context7Config.getApiBaseUrl());

        logger.debug("Configuration validation - API key valid: {}, base URL valid: {}", apiKeyValid, baseUrlValid);

        return apiKeyValid && baseUrlValid;
    }

    private static boolean isValid(String value) {
        return value != null && !value.trim().isEmpty() && !value.contains("${");
    }

    /**
     * Finds Context7 credentials in the VCAP_SERVICES JSON structure.
     * 
     * @param vcapServicesNode The parsed VCAP_SERVICES JSON node
     * @return The credentials node of the first service whose name contains "context7", or null
     */
    private JsonNode findContext7Credentials(JsonNode vcapServicesNode) {
        for (JsonNode serviceNode : vcapServicesNode) {
            for (JsonNode service : serviceNode) {
                String serviceName = service.path("name").asText();
                logger.debug("Found service: {}", serviceName);
                if (serviceName.toLowerCase().contains("context7")) {
                    logger.info("Found Context7 service: {}", serviceName);
                    return service.path("credentials");
                }
            }
        }
        return null;
    }

    /**
     * Copies binding credentials into settings that are still missing.
     * 
     * Recognized credential keys: api_key, url, client_ip_encryption_key.
     * 
     * @param credentials The credentials JsonNode from VCAP_SERVICES
     */
    private void updateConfigurationFromVCap(JsonNode credentials) {
        if (!isValid(context7Config.getApiKey()) && credentials.hasNonNull("api_key")) {
            context7Config.setApiKey(credentials.path("api_key").asText());
            logger.info("Set API key from VCAP: ***");
        }

        if (!isValid(context7Config.getApiBaseUrl()) && credentials.hasNonNull("url")) {
            String url = credentials.path("url").asText();
            context7Config.setApiBaseUrl(url);
            logger.info("Set API base URL from VCAP: {}", url);
        }

        if (!isValid(context7Config.getClientIpEncryptionKey()) && credentials.hasNonNull("client_ip_encryption_key")) {
            context7Config.setClientIpEncryptionKey(credentials.path("client_ip_encryption_key").asText());
            logger.info("Set client IP encryption key from VCAP: ***");
        }
    }
}
