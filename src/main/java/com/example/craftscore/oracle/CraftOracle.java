package com.example.craftscore.oracle;

import com.example.craftscore.exception.OracleUnavailableException;
import com.example.craftscore.model.ScoringContext;

/**
 * Opaque text-generation dependency used to assess projects.
 */
public interface CraftOracle {

    /**
     * @param prompt  Task for the oracle
     * @param context Author and project context of the current scoring pass
     * @return reply text and self-reported confidence
     * @throws OracleUnavailableException when no usable reply could be obtained
     */
    OracleReply generate(String prompt, ScoringContext context);
}
