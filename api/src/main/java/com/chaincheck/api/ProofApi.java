package com.chaincheck.api;

import com.chaincheck.api.response.DivinerVerificationResponse;
import com.chaincheck.api.response.ProofVerificationResponse;
import com.chaincheck.api.response.ValidationResponse;
import com.chaincheck.api.response.WitnessChainResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Proof API interface for read-only queries against the proof ledger.
 *
 * <p>Implemented by ProofController (service module) and ProofClient (api module).
 */
@RequestMapping("/api/v1/proofs")
public interface ProofApi {

    /**
     * Verifies a proof hash. The ledger is queried first, the archival index second.
     *
     * @param proofHash Witness record hash (64 hex characters, optional 0x prefix)
     * @return Verification result; not found is reported as {@code valid=false}
     */
    @GetMapping("/{proofHash}/verify")
    ResponseEntity<ProofVerificationResponse> verifyProof(
            @PathVariable("proofHash") String proofHash);

    /**
     * Walks the witness chain backwards from a record.
     *
     * @param proofHash Starting record hash
     * @param maxDepth  Maximum number of records to return
     * @return Chain, newest first
     */
    @GetMapping("/{proofHash}/chain")
    ResponseEntity<WitnessChainResponse> getWitnessChain(
            @PathVariable("proofHash") String proofHash,
            @RequestParam(value = "maxDepth", defaultValue = "10") int maxDepth);

    /**
     * Validates the structure of a record held by the archival index.
     *
     * @param proofHash Record hash
     * @return Validation result
     */
    @GetMapping("/{proofHash}/validate")
    ResponseEntity<ValidationResponse> validateProof(
            @PathVariable("proofHash") String proofHash);

    /**
     * Queries location consensus for a point in time.
     *
     * @param latitude  Latitude
     * @param longitude Longitude
     * @param timestamp Epoch milliseconds
     * @return Corroboration result
     */
    @GetMapping("/diviner")
    ResponseEntity<DivinerVerificationResponse> queryDiviner(
            @RequestParam("lat") double latitude,
            @RequestParam("lon") double longitude,
            @RequestParam("timestamp") long timestamp);
}
