package io.swapgate.backend.controller;

import io.swapgate.backend.risk.RiskAssessment;
import io.swapgate.backend.risk.RiskCheckRequest;
import io.swapgate.backend.risk.TransactionRiskScorer;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/v1/risk", produces = MediaType.APPLICATION_JSON_VALUE)
public class RiskController {
  private final TransactionRiskScorer scorer;

  public RiskController(TransactionRiskScorer scorer) {
    this.scorer = scorer;
  }

  @PostMapping(path = "/score", consumes = MediaType.APPLICATION_JSON_VALUE)
  public RiskAssessment score(@Valid @RequestBody RiskCheckRequest request) {
    return scorer.score(request);
  }
}
