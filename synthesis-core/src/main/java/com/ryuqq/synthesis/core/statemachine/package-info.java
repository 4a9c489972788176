/**
 * Poller state machine package.
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * SUBMITTED → POLLING
 * POLLING → DONE | FAILED | CANCELLED
 *
 * Forbidden:
 * - DONE, FAILED, CANCELLED → * (terminal states)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * PollState state = PollState.SUBMITTED;
 * state = PollTransition.transition(state, PollState.POLLING);
 * state = PollTransition.transition(state, PollState.DONE);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.synthesis.core.statemachine;
