package com.vpcrouter.router;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Picks the most specific route for a request.
 *
 * <p>Ranking, highest first: exact, then prefix (longer prefix first), then wildcard
 * (longer base first). Routes of equal rank keep declaration order, so the first
 * declared one wins.
 */
@Slf4j
@Component
public class RouteMatcher {

    public Optional<Route> match(RouteTable table, RouteQuery query) {
        Route best = null;
        for (Route route : table.getRoutes()) {
            if (!route.getMatch().matches(query)) {
                continue;
            }
            if (best == null || outranks(route.getMatch(), best.getMatch())) {
                best = route;
            }
        }
        if (best != null) {
            log.debug("Matched {} {} to route {}", query.getMethod(), query.getPath(), best.getId());
        }
        return Optional.ofNullable(best);
    }

    // strictly better only; equal candidates keep the earlier declaration
    static boolean outranks(RouteMatch candidate, RouteMatch current) {
        int byKind = Integer.compare(candidate.getKind().rank(), current.getKind().rank());
        if (byKind != 0) {
            return byKind > 0;
        }
        return candidate.specificity() > current.specificity();
    }
}
