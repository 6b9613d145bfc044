package com.sqconfig.core.audit;

import com.sqconfig.core.client.Platform;
import com.sqconfig.core.model.AuditProblem;
import com.sqconfig.core.model.AuditSettings;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.Portfolio;
import com.sqconfig.core.model.RuleId;
import com.sqconfig.core.selection.SelectionMode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class PortfolioAuditor implements ObjectAuditor<Portfolio> {

    @Override
    public ObjectType type() {
        return ObjectType.PORTFOLIO;
    }

    @Override
    public List<Portfolio> list(Platform platform) {
        return new ArrayList<>(Portfolio.search(platform).values());
    }

    @Override
    public List<AuditProblem> audit(Portfolio portfolio, AuditSettings settings) {
        var subject = portfolio.toString();
        var mode = portfolio.selection().currentMode();
        boolean hasSubPortfolios = !portfolio.subPortfolios().isEmpty();
        if (mode instanceof SelectionMode.None && !hasSubPortfolios) {
            return List.of(AuditProblem.of(RuleId.PORTFOLIO_EMPTY, subject, portfolio.url(), subject));
        }
        if (mode instanceof SelectionMode.Manual manual && !hasSubPortfolios) {
            if (manual.projects().isEmpty()) {
                return List.of(AuditProblem.of(RuleId.PORTFOLIO_EMPTY, subject, portfolio.url(), subject));
            }
            if (manual.projects().size() == 1) {
                return List.of(AuditProblem.of(RuleId.PORTFOLIO_SINGLETON, subject, portfolio.url(), subject));
            }
        }
        return List.of();
    }
}
