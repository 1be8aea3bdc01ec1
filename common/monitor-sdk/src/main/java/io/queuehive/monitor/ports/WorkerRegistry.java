package io.queuehive.monitor.ports;

import java.util.List;

/**
 * Lookup of worker processes serving a queue.
 */
public interface WorkerRegistry {

  String STATUS_ACTIVE = "active";

  List<String> listWorkers(String queueName) throws Exception;

  /**
   * @return {@code "active"} for a worker currently processing a job, anything else otherwise
   */
  String getWorkerStatus(String workerId) throws Exception;

  static WorkerRegistry none() {
    return new WorkerRegistry() {
      @Override
      public List<String> listWorkers(String queueName) {
        return List.of();
      }

      @Override
      public String getWorkerStatus(String workerId) {
        return "unknown";
      }
    };
  }
}
