/**
 * Configuration records, file loaders and the composition root.
 * <p>Sources are merged CLI &gt; YAML &gt; properties &gt; defaults into one flat map, then split into the
 * per-concern settings records by {@link ca.gc.cra.harness.config.HarnessConfig#fromMap(java.util.Map)}.</p>
 */
package ca.gc.cra.harness.config;
