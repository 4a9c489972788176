/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Boundaries to the outside world. Adapters implement these; the orchestrator only talks to
 * them through the retry executor, always passing the orchestration's cancellation token.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.synthesis.core.spi.SynthesisClient} - Submit, poll, edit image, analyze montage</li>
 *   <li>{@link com.ryuqq.synthesis.core.spi.ArtifactFetcher} - Download the final media</li>
 *   <li>{@link com.ryuqq.synthesis.core.spi.CredentialResync} - Open the credential selector</li>
 *   <li>{@link com.ryuqq.synthesis.core.spi.ApiKeyProvider} - Key appended to artifact URIs</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.synthesis.core.spi;
