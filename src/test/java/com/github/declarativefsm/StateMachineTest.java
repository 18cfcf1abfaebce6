package com.github.declarativefsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import com.github.declarativefsm.MachineConfiguration.MachineConfigurationBuilder;
import com.github.declarativefsm.StateMachine.StateMachineBuilder;
import com.github.declarativefsm.StateMachineException.Code;
import com.github.declarativefsm.StateNode.StateNodeBuilder;
import com.github.declarativefsm.Transition.TransitionBuilder;

/**
 * Tests to maintain the sanity and correctness of StateMachine construction and resolution.
 */
public class StateMachineTest {

  @Test
  public void testShorthandTransitionResolvesToTarget() throws StateMachineException {
    final StateMachine machine = cyclicMachine();
    assertEquals("A", machine.getInitialStateKey());
    assertEquals(Arrays.asList("A", "B", "C", "D"), machine.getStateKeys());

    final Optional<TransitionResult> result = machine.resolve("A", Event.of("NEXT"));
    assertTrue(result.isPresent());
    assertEquals("A", result.get().getSource());
    assertEquals("NEXT", result.get().getEventType());
    assertEquals(Optional.of("B"), result.get().getTarget());
    assertEquals("B", result.get().getResultingStateKey());
    assertFalse(result.get().isInternal());
    assertTrue(result.get().getActions().isEmpty());

    assertEquals("A", machine.resolve("D", Event.of("NEXT")).get().getResultingStateKey());
  }

  @Test
  public void testUnmatchedEventResolvesToNothing() throws StateMachineException {
    final StateMachine machine = cyclicMachine();
    assertFalse(machine.resolve("A", Event.of("PREVIOUS")).isPresent());
    // matching is exact and case-sensitive
    assertFalse(machine.resolve("A", Event.of("next")).isPresent());
  }

  @Test
  public void testExternalTransitionCarriesExitTransitionAndEntryActions()
      throws StateMachineException {
    final Action exitA = () -> {
    };
    final Action enterB = () -> {
    };
    final Action onNext = () -> {
    };
    final MachineConfiguration config = MachineConfigurationBuilder.newBuilder().initial("A")
        .state(StateNodeBuilder.newBuilder("A").exit(exitA)
            .on("NEXT", TransitionBuilder.newBuilder().target("B").actions(onNext).build())
            .build())
        .state(StateNodeBuilder.newBuilder("B").entry(Actions.list(enterB)).on("NEXT", "A")
            .build())
        .build();
    final StateMachine machine = StateMachine.create(config);

    final TransitionResult result = machine.resolve("A", Event.of("NEXT")).get();
    assertEquals(Actions.of(exitA), result.getExitActions());
    assertEquals(Actions.of(onNext), result.getActions());
    assertEquals(Actions.list(enterB), result.getEntryActions());
    assertTrue(result.getActions().isSingle());
    assertFalse(result.getEntryActions().isSingle());
  }

  @Test
  public void testInternalTransitionCarriesOnlyItsOwnActions() throws StateMachineException {
    final MachineConfiguration config = MachineConfigurationBuilder.newBuilder().initial("A")
        .state(StateNodeBuilder.newBuilder("A").entry("enterA").exit("exitA")
            .on("TICK", TransitionBuilder.newBuilder().actions("tick").build()).build())
        .build();
    final StateMachine machine = StateMachine.create(config);

    final TransitionResult result = machine.resolve("A", Event.of("TICK")).get();
    assertTrue(result.isInternal());
    assertFalse(result.getTarget().isPresent());
    assertEquals("A", result.getResultingStateKey());
    assertTrue(result.getExitActions().isEmpty());
    assertTrue(result.getEntryActions().isEmpty());
    assertEquals(Actions.of("tick"), result.getActions());
  }

  @Test
  public void testResolveRunsNoActions() throws StateMachineException {
    final AtomicInteger calls = new AtomicInteger();
    final Action counting = () -> calls.incrementAndGet();
    final MachineConfiguration config = MachineConfigurationBuilder.newBuilder().initial("A")
        .state(StateNodeBuilder.newBuilder("A").exit(counting).entry(counting)
            .on("NEXT", TransitionBuilder.newBuilder().target("B").actions(counting).build())
            .build())
        .state(StateNodeBuilder.newBuilder("B").entry(counting).build()).build();
    final StateMachine machine = StateMachine.create(config);

    final TransitionResult first = machine.resolve("A", Event.of("NEXT")).get();
    final TransitionResult second = machine.resolve("A", Event.of("NEXT")).get();
    assertEquals(0, calls.get());
    assertEquals(first.getTarget(), second.getTarget());
    assertEquals(first.getActions(), second.getActions());
  }

  @Test
  public void testResolveIgnoresPayload() throws StateMachineException {
    final StateMachine machine = cyclicMachine();
    final Event withPayload =
        Event.of("NEXT", Collections.<String, Object>singletonMap("by", "test"));
    assertEquals("B", machine.resolve("A", withPayload).get().getResultingStateKey());
    assertEquals("test", withPayload.getPayload().get("by"));
  }

  @Test
  public void testResolveUnknownStateFails() throws StateMachineException {
    final StateMachine machine = cyclicMachine();
    try {
      machine.resolve("Z", Event.of("NEXT"));
      fail("Expected unknown state to fail");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
  }

  @Test
  public void testEventTypesPerState() throws StateMachineException {
    final MachineConfiguration config = MachineConfigurationBuilder.newBuilder().initial("idle")
        .states(
            StateNodeBuilder.newBuilder("idle").on("FETCH", "loading").on("RESET", "idle")
                .build(),
            StateNodeBuilder.newBuilder("loading").on("DONE", "idle").build())
        .build();
    final StateMachine machine = StateMachine.create(config);
    assertEquals(new LinkedHashSet<>(Arrays.asList("FETCH", "RESET")),
        machine.getEventTypes("idle"));
    assertEquals(new LinkedHashSet<>(Arrays.asList("DONE")), machine.getEventTypes("loading"));
    assertSame(config, machine.getConfiguration());
    assertEquals("loading", machine.getState("loading").getKey());
  }

  @Test
  public void testMachinesHaveDistinctIds() throws StateMachineException {
    final StateMachine one = cyclicMachine();
    final StateMachine two = cyclicMachine();
    assertNotEquals(one.getId(), two.getId());
  }

  @Test
  public void testDanglingInitialFailsConfiguration() {
    try {
      MachineConfigurationBuilder.newBuilder().initial("Z")
          .state(StateNodeBuilder.newBuilder("A").build()).build();
      fail("Expected dangling initial to fail");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_MACHINE_CONFIG, expected.getCode());
      assertTrue(expected.getMessage().contains("Initial state not found in states: Z"));
    }
  }

  @Test
  public void testDanglingTargetFailsConfiguration() {
    try {
      MachineConfigurationBuilder.newBuilder().initial("A")
          .state(StateNodeBuilder.newBuilder("A").on("NEXT", "B").build()).build();
      fail("Expected dangling target to fail");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_MACHINE_CONFIG, expected.getCode());
      assertTrue(expected.getMessage().contains("undeclared target: B"));
    }
  }

  @Test
  public void testAllConfigurationProblemsAreReported() {
    try {
      MachineConfigurationBuilder.newBuilder().initial("Z")
          .state(StateNodeBuilder.newBuilder("A").on("NEXT", "B").build())
          .state(StateNodeBuilder.newBuilder("A").build())
          .state(StateNodeBuilder.newBuilder(" ").build()).build();
      fail("Expected configuration to fail");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_MACHINE_CONFIG, expected.getCode());
      final String message = expected.getMessage();
      assertTrue(message.contains("Duplicate state key: A"));
      assertTrue(message.contains("State key cannot be null or blank"));
      assertTrue(message.contains("Initial state not found in states: Z"));
      assertTrue(message.contains("undeclared target: B"));
    }
  }

  @Test
  public void testShorthandTransitionNeedsTarget() {
    try {
      Transition.to(null);
      fail("Expected null shorthand target to fail");
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage().contains("target cannot be null or blank"));
    }
    try {
      StateNodeBuilder.newBuilder("A").on("NEXT", (String) null);
      fail("Expected null shorthand target to fail");
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage().contains("target cannot be null or blank"));
    }
    try {
      StateNodeBuilder.newBuilder("A").on("NEXT", " ");
      fail("Expected blank shorthand target to fail");
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage().contains("target cannot be null or blank"));
    }
    // an internal transition is spelled out without a target
    assertTrue(TransitionBuilder.newBuilder().build().isInternal());
  }

  @Test
  public void testEmptyConfigurationFails() {
    try {
      MachineConfigurationBuilder.newBuilder().build();
      fail("Expected empty configuration to fail");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_MACHINE_CONFIG, expected.getCode());
      assertTrue(expected.getMessage().contains("States cannot be empty"));
      assertTrue(expected.getMessage().contains("Initial state key cannot be null or blank"));
    }
  }

  @Test
  public void testNullConfigurationFailsMachine() {
    try {
      StateMachineBuilder.newBuilder().build();
      fail("Expected null configuration to fail");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_MACHINE_CONFIG, expected.getCode());
    }
  }

  @Test
  public void testBlankEventTypeFails() {
    try {
      Event.of(" ");
      fail("Expected blank event type to fail");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_EVENT, expected.getCode());
    }
  }

  @Test
  public void testActionsRememberDeclaredShape() {
    final Action action = () -> {
    };
    assertTrue(Actions.of(action).isSingle());
    assertTrue(Actions.of("named").isSingle());
    assertFalse(Actions.list("named").isSingle());
    assertEquals(1, Actions.list("named").size());
    assertNotEquals(Actions.of("named"), Actions.list("named"));
    assertEquals(ActionReference.named("named"), Actions.of("named").getSingle());
    assertEquals(ActionReference.to(action), Actions.of(action).getSingle());
    assertNotEquals(ActionReference.to(action), ActionReference.to(() -> {
    }));
    assertTrue(Actions.none().isEmpty());
  }

  static StateMachine cyclicMachine() throws StateMachineException {
    final MachineConfiguration config = MachineConfigurationBuilder.newBuilder().initial("A")
        .states(StateNodeBuilder.newBuilder("A").on("NEXT", "B").build(),
            StateNodeBuilder.newBuilder("B").on("NEXT", "C").build(),
            StateNodeBuilder.newBuilder("C").on("NEXT", "D").build(),
            StateNodeBuilder.newBuilder("D").on("NEXT", "A").build())
        .build();
    return StateMachineBuilder.newBuilder().config(config).build();
  }

}
