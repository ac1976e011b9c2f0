package com.wallet.monitor.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.wallet.monitor.config.TestAerospikeConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Guards the published OpenAPI document against accidental drift in paths and schemas.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> paths = json.read("$.paths");

        // Wallets
        assertThat(paths).containsKey("/api/v1/wallets");
        assertThat(paths).containsKey("/api/v1/wallets/distribution");
        assertThat(paths).containsKey("/api/v1/wallets/{chain}/{address}");
        assertThat(paths).containsKey("/api/v1/wallets/{chain}/{address}/balance");

        // Transactions
        assertThat(paths).containsKey("/api/v1/transactions");
        assertThat(paths).containsKey("/api/v1/transactions/{hash}");
        assertThat(paths).containsKey("/api/v1/transactions/sync");
        assertThat(paths).containsKey("/api/v1/transactions/analyze");
        assertThat(paths).containsKey("/api/v1/transactions/stats/summary");

        // Rules
        assertThat(paths).containsKey("/api/v1/rules");
        assertThat(paths).containsKey("/api/v1/rules/{ruleId}");
        assertThat(paths).containsKey("/api/v1/rules/reload");
        assertThat(paths).containsKey("/api/v1/rules/evaluate/{hash}");

        // Alerts
        assertThat(paths).containsKey("/api/v1/alerts");
        assertThat(paths).containsKey("/api/v1/alerts/{alertId}");
        assertThat(paths).containsKey("/api/v1/alerts/{alertId}/resolve");
        assertThat(paths).containsKey("/api/v1/alerts/stats/patterns");

        // Chains
        assertThat(paths).containsKey("/api/v1/chains");
        assertThat(paths).containsKey("/api/v1/chains/{chain}/block");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("Transaction");
        assertThat(schemas).containsKey("Alert");
        assertThat(schemas).containsKey("AlertRule");
        assertThat(schemas).containsKey("Wallet");
        assertThat(schemas).containsKey("SyncResult");
    }

    @Test
    void openApiSpec_transactionAndAlertSchemas_haveRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> txnProps = json.read("$.components.schemas.Transaction.properties");
        assertThat(txnProps).containsKey("hash");
        assertThat(txnProps).containsKey("walletAddress");
        assertThat(txnProps).containsKey("chain");
        assertThat(txnProps).containsKey("amount");
        assertThat(txnProps).containsKey("anomalyScore");
        assertThat(txnProps).containsKey("riskLevel");

        Map<String, Object> alertProps = json.read("$.components.schemas.Alert.properties");
        assertThat(alertProps).containsKey("ruleId");
        assertThat(alertProps).containsKey("alertType");
        assertThat(alertProps).containsKey("riskLevel");
        assertThat(alertProps).containsKey("status");
    }
}
