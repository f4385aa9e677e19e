package in.spreadarb.service.opportunity.rule;

import in.spreadarb.service.opportunity.EntryContext;

import java.util.Optional;

/**
 * One entry condition. Returns the rejection reason when the condition fails.
 */
@FunctionalInterface
public interface EntryRule {

    Optional<String> check(EntryContext context);
}
