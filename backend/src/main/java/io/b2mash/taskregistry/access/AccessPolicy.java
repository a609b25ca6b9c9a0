package io.b2mash.taskregistry.access;

import io.b2mash.taskregistry.exception.ForbiddenException;
import org.springframework.stereotype.Component;

/**
 * The registry's authorization rules in one place. Every mutating operation asks this policy
 * whether {@code caller} may perform it, given the registry owner and (for task operations) the
 * task's current assignee.
 */
@Component
public class AccessPolicy {

  /**
   * Evaluates the role requirement of {@code operation}.
   *
   * @param assignee the task's current assignee; ignored for operations that do not require the
   *     assignee role
   */
  public AccessDecision evaluate(
      Principal caller, Principal owner, Principal assignee, TaskOperation operation) {
    if (caller == null || caller.isNone()) {
      return AccessDecision.deny("no caller identity");
    }
    return switch (operation.requiredRole()) {
      case ANYONE -> AccessDecision.allow();
      case OWNER ->
          caller.equals(owner)
              ? AccessDecision.allow()
              : AccessDecision.deny("caller is not the registry owner");
      case ASSIGNEE ->
          caller.equals(assignee)
              ? AccessDecision.allow()
              : AccessDecision.deny("caller is not the task assignee");
    };
  }

  /** Like {@link #evaluate} but throws {@link ForbiddenException} on denial. */
  public void require(
      Principal caller, Principal owner, Principal assignee, TaskOperation operation) {
    var decision = evaluate(caller, owner, assignee, operation);
    if (!decision.allowed()) {
      throw new ForbiddenException("Unauthorized", decision.reason());
    }
  }
}
