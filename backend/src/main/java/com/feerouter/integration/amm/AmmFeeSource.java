package com.feerouter.integration.amm;

import com.fasterxml.jackson.databind.JsonNode;
import com.feerouter.error.IntegrationException;
import com.feerouter.integration.FeeClaim;
import com.feerouter.integration.FeeSource;
import com.feerouter.integration.rpc.JsonRpcResponses;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * {@code claimPositionFee} on the AMM gateway. Sent exactly once per call: a claim that succeeded upstream but
 * timed out locally has already drained the fees, so a blind retry would under-report the day.
 */
@RequiredArgsConstructor
public class AmmFeeSource implements FeeSource {

    private final AmmGatewayClient client;

    @Override
    public FeeClaim claim(String positionHandle, String designatedAsset) {
        String method = AmmGatewayClient.CLAIM_POSITION_FEE;
        JsonNode result = client.invoke(method, List.of(positionHandle));
        String tokenA = JsonRpcResponses.text(result, "tokenAMint", method);
        String tokenB = JsonRpcResponses.text(result, "tokenBMint", method);
        long amountA = JsonRpcResponses.amount(result, "tokenAAmount", method);
        long amountB = JsonRpcResponses.amount(result, "tokenBAmount", method);
        if (designatedAsset.equals(tokenB)) {
            return new FeeClaim(amountB, amountA);
        }
        if (designatedAsset.equals(tokenA)) {
            return new FeeClaim(amountA, amountB);
        }
        throw new IntegrationException("Claim for position " + positionHandle
                + " does not involve designated asset " + designatedAsset);
    }
}
