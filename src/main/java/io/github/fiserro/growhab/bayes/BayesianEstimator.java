package io.github.fiserro.growhab.bayes;

import io.github.fiserro.growhab.Condition;
import io.github.fiserro.growhab.ConfigurationException;
import io.github.fiserro.growhab.config.LikelihoodSettings;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import lombok.extern.slf4j.Slf4j;

/**
 * Naive Bayes combination of independent likelihood ratios, in log-odds form:
 *
 * <pre>
 * logit(posterior) = logit(prior) + sum(ln(clamp(ratio_i)))
 * </pre>
 *
 * Every ratio is clamped to the configured bounds, so no single variable drives the posterior to 0
 * or 1. Stateless and safe to share between growspaces.
 */
@Slf4j
public class BayesianEstimator {

  public PosteriorEstimate estimate(ConditionModel model, double prior, EvidenceContext context) {
    List<VariableEvidence> evidence =
        model.sources().stream()
            .map(source -> source.evaluate(context))
            .flatMap(Optional::stream)
            .toList();
    return combine(model.condition(), prior, evidence, context.likelihood());
  }

  /**
   * Combines already evaluated evidence. Returns an insufficient estimate when no sensor-backed
   * evidence is present; contextual evidence alone never yields a posterior.
   *
   * @throws ConfigurationException if the prior is not strictly between 0 and 1
   */
  public PosteriorEstimate combine(
      Condition condition,
      double prior,
      List<VariableEvidence> evidence,
      LikelihoodSettings likelihood) {
    requireValidPrior(condition, prior);

    if (evidence.stream().allMatch(VariableEvidence::contextual)) {
      log.debug("{}: no sensor evidence available", condition.key());
      return PosteriorEstimate.insufficient(condition, prior);
    }

    List<VariableEvidence> clamped =
        evidence.stream()
            .map(e -> e.withLikelihoodRatio(likelihood.clamp(e.likelihoodRatio())))
            .toList();

    double logOdds = Math.log(prior / (1 - prior));
    for (VariableEvidence e : clamped) {
      logOdds += Math.log(e.likelihoodRatio());
    }
    double posterior = 1 / (1 + Math.exp(-logOdds));

    log.debug(
        "{}: prior={} posterior={} from {} evidence",
        condition.key(),
        prior,
        String.format("%.4f", posterior),
        clamped.size());
    return new PosteriorEstimate(condition, prior, OptionalDouble.of(posterior), clamped);
  }

  static void requireValidPrior(Condition condition, double prior) {
    if (!(prior > 0 && prior < 1)) {
      throw new ConfigurationException(
          String.format(
              "Prior of %s must be strictly between 0 and 1, got %s", condition.key(), prior));
    }
  }
}
