/**
 * Thread factories for pipeline stages.
 * <p><strong>Role:</strong> Infrastructure utilities; each stage runs on exactly one thread produced here.</p>
 * <p><strong>Concurrency:</strong> Factory methods are thread-safe; thread names are unique per JVM.</p>
 * <p><strong>Observability:</strong> Named threads make stage ownership visible in thread dumps and log lines.</p>
 */
package ca.gc.cra.safestream.infrastructure.exec;
