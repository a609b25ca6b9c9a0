package io.b2mash.taskregistry.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.taskregistry.access.Principal;
import org.junit.jupiter.api.Test;

class RequestScopesTest {

  private static final Principal ALICE = Principal.of("alice");
  private static final Principal BOB = Principal.of("bob");

  @Test
  void requireCaller_throws_when_unbound() {
    assertThat(RequestScopes.isCallerBound()).isFalse();
    assertThatThrownBy(RequestScopes::requireCaller)
        .isInstanceOf(CallerContextNotBoundException.class);
  }

  @Test
  void callAs_binds_for_the_duration_of_the_block() {
    var seen = RequestScopes.callAs(ALICE, RequestScopes::requireCaller);

    assertThat(seen).isEqualTo(ALICE);
    assertThat(RequestScopes.getCallerOrNull()).isNull();
  }

  @Test
  void nested_binding_restores_outer_caller() {
    RequestScopes.runAs(
        ALICE,
        () -> {
          RequestScopes.runAs(
              BOB, () -> assertThat(RequestScopes.requireCaller()).isEqualTo(BOB));
          assertThat(RequestScopes.requireCaller()).isEqualTo(ALICE);
        });

    assertThat(RequestScopes.isCallerBound()).isFalse();
  }

  @Test
  void binding_removed_when_block_throws() {
    assertThatThrownBy(
            () ->
                RequestScopes.runAs(
                    ALICE,
                    () -> {
                      throw new IllegalStateException("boom");
                    }))
        .hasMessage("boom");

    assertThat(RequestScopes.isCallerBound()).isFalse();
  }
}
