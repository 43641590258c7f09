package io.tower.api.config;

public class DuplicateCaseNumberException extends TowerDefinitionException {
   private final String caseNum;

   public DuplicateCaseNumberException(String caseNum, String where) {
      super("Case number '" + caseNum + "' is already used" + (where == null ? "" : " (in " + where + ")"));
      this.caseNum = caseNum;
   }

   public String caseNum() {
      return caseNum;
   }
}
