package io.queuehive.monitor.ports;

/**
 * Narrow view of a queue's job lifecycle event stream.
 */
public interface QueueEventListener {

  void onWaiting(String jobId);

  void onActive(String jobId);

  void onCompleted(String jobId, Object result);

  void onFailed(String jobId, String reason);

  void onStalled(String jobId);

  void onProgress(String jobId, Object data);
}
