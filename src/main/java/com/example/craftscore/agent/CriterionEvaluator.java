package com.example.craftscore.agent;

import com.example.craftscore.model.CriterionEvaluation;
import com.example.craftscore.model.CriterionKind;
import com.example.craftscore.model.DocumentationAnalysis;
import com.example.craftscore.model.ProjectScoringRequest;
import com.example.craftscore.model.ScoringContext;
import com.example.craftscore.oracle.CraftOracle;
import com.example.craftscore.oracle.OracleReply;
import com.example.craftscore.service.ScoringFramework;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Scores one criterion of one submission through the criterion oracle.
 * Never throws: any oracle problem yields {@link CriterionEvaluation#fallback(CriterionKind)}.
 */
@Service
public class CriterionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(CriterionEvaluator.class);

    private final CraftOracle oracle;

    public CriterionEvaluator(@Qualifier("criterionOracle") CraftOracle oracle) {
        this.oracle = oracle;
    }

    public CriterionEvaluation evaluate(ProjectScoringRequest request, ScoringContext context, CriterionKind kind) {
        DocumentationAnalysis documentation = ScoringFramework.documentationHeuristic(request);
        try {
            OracleReply reply = oracle.generate(CriterionPrompts.promptFor(kind, request, documentation), context);
            if (reply == null || reply.text() == null || reply.text().isBlank()) {
                log.warn("CriterionEvaluator: blank reply for {} on project {}, using fallback",
                        kind.key(), request.projectId());
                return CriterionEvaluation.fallback(kind);
            }

            CriterionEvaluation parsed = CriterionReplyParser.parse(reply.text(), reply.selfReportedConfidence());
            if (kind == CriterionKind.DOCUMENTATION_COMPLETENESS) {
                int blended = ScoringFramework.blendDocumentationScore(parsed.score(), documentation.completenessScore());
                parsed = new CriterionEvaluation(blended, parsed.feedback(), parsed.confidence());
            }
            log.debug("CriterionEvaluator: {} = {} (confidence {}) for project {}",
                    kind.key(), parsed.score(), parsed.confidence(), request.projectId());
            return parsed;

        } catch (Exception e) {
            log.warn("CriterionEvaluator: {} evaluation failed for project {}, using fallback: {}",
                    kind.key(), request.projectId(), e.getMessage());
            return CriterionEvaluation.fallback(kind);
        }
    }
}
