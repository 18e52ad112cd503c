package dao.relay.oracle.parachain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.relay.oracle.config.ParachainProperties;
import dao.relay.oracle.model.OracleConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Startup checks: the ABI file declares the functions the oracle calls, and the contract has code.
 */
@Slf4j
@Component
public class ContractAbiVerifier {

    static final List<String> REQUIRED_FUNCTIONS = List.of("reportRelay", "getStashAccounts", "isReportedLastEra");

    private final ResourceLoader resourceLoader;
    private final ObjectMapper mapper;
    private final ParachainProperties props;

    public ContractAbiVerifier(ResourceLoader resourceLoader, ObjectMapper mapper, ParachainProperties props) {
        this.resourceLoader = resourceLoader;
        this.mapper = mapper;
        this.props = props;
    }

    public void verify(ParachainGateway gateway) {
        verifyAbi();
        verifyCode(gateway, props.getContractAddress());
        if (props.hasCoordinator()) {
            verifyCode(gateway, props.getCoordinatorAddress());
        }
    }

    void verifyAbi() {
        Set<String> declared = declaredFunctions();
        for (String fn : REQUIRED_FUNCTIONS) {
            if (!declared.contains(fn)) {
                throw new OracleConfigurationException("ABI " + props.getAbiPath() + " does not declare " + fn);
            }
        }
        log.info("ABI {} declares {}", props.getAbiPath(), REQUIRED_FUNCTIONS);
    }

    void verifyCode(ParachainGateway gateway, String address) {
        String code = gateway.code(address);
        if (code == null || Numeric.cleanHexPrefix(code).isEmpty()) {
            throw new OracleConfigurationException("No contract code at " + address + " on " + gateway.url());
        }
    }

    private Set<String> declaredFunctions() {
        Resource resource = resourceLoader.getResource(props.getAbiPath());
        if (!resource.exists()) {
            throw new OracleConfigurationException("ABI file not found: " + props.getAbiPath());
        }
        JsonNode abi;
        try (InputStream in = resource.getInputStream()) {
            abi = mapper.readTree(in);
        } catch (IOException e) {
            throw new OracleConfigurationException("Cannot read ABI " + props.getAbiPath() + ": " + e.getMessage(), e);
        }
        if (abi == null || !abi.isArray()) {
            throw new OracleConfigurationException("ABI " + props.getAbiPath() + " is not a JSON array");
        }
        Set<String> names = new HashSet<>();
        for (JsonNode entry : abi) {
            if ("function".equals(entry.path("type").asText()) && entry.hasNonNull("name")) {
                names.add(entry.get("name").asText());
            }
        }
        return names;
    }
}
