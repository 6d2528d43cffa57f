package com.quantumskylink.orchestration.pipeline;

import com.quantumskylink.orchestration.client.SignatureServiceClient;
import com.quantumskylink.orchestration.client.dto.ResultSignatureValidationRequest;
import com.quantumskylink.orchestration.client.dto.SignatureValidationRequest;
import com.quantumskylink.orchestration.client.dto.SignatureValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Signature checks shared by the signed pipelines.
 *
 * A request with no signature or no nonce is rejected without calling the
 * verifier. Transport faults propagate as {@code DownstreamException} and
 * are classified by the runner.
 */
@Component
public class SignatureGate {

    private static final Logger log = LoggerFactory.getLogger(SignatureGate.class);

    private final SignatureServiceClient signatures;

    public SignatureGate(SignatureServiceClient signatures) {
        this.signatures = signatures;
    }

    /**
     * Verify that {@code request} was signed by {@code accountId} for {@code operation}.
     *
     * @param operationData the business payload the signature covers
     */
    public SignatureCheck verifyRequest(SignedRequest request, String accountId,
                                        String operation, Object operationData) {
        if (isBlank(request.signature()) || isBlank(request.nonce()) || request.timestamp() == null) {
            return SignatureCheck.rejected("Missing signature, nonce or timestamp for " + operation);
        }
        SignatureValidationResult result = signatures.validateRequest(new SignatureValidationRequest(
                accountId, operation, operationData,
                request.nonce(), request.sequenceNumber(), request.timestamp(),
                request.signature(), request.algorithm()));
        if (!result.valid()) {
            log.warn("Signature rejected for {} by account {}: {}", operation, accountId, result.message());
            return SignatureCheck.rejected("Signature validation failed: " + result.message());
        }
        return SignatureCheck.accepted(result.validationId());
    }

    /** Verify a downstream result's signature against the original request validation. */
    public SignatureCheck verifyResult(String originalValidationId, Object resultData,
                                       String resultSignature, String signingService) {
        if (isBlank(resultSignature)) {
            return SignatureCheck.rejected(signingService + " returned an unsigned result");
        }
        SignatureValidationResult result = signatures.validateResult(new ResultSignatureValidationRequest(
                originalValidationId, resultData, resultSignature, signingService));
        if (!result.valid()) {
            log.warn("Result signature from {} rejected: {}", signingService, result.message());
            return SignatureCheck.rejected("Result signature validation failed: " + result.message());
        }
        return SignatureCheck.accepted(result.validationId());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
