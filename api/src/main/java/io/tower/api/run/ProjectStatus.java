package io.tower.api.run;

import java.io.Serializable;
import java.util.List;

public final class ProjectStatus implements Serializable {
   public final String projectName;
   public final List<CaseStatus> runningCases;
   public final List<CaseStatus> allCases;

   public ProjectStatus(String projectName, List<CaseStatus> runningCases, List<CaseStatus> allCases) {
      this.projectName = projectName;
      this.runningCases = List.copyOf(runningCases);
      this.allCases = List.copyOf(allCases);
   }

   public long count(RunStatus status) {
      return allCases.stream().filter(c -> c.status == status).count();
   }
}
