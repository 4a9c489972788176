/**
 * In-memory credential adapters: a mutable API key holder and a recording credential selector.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.synthesis.adapter.inmemory.credential;
