package io.tower.api.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Keeps case numbers unique within one project. Setup and teardown cases are not registered.
 */
public class CaseNumberRegistry {
   private final Map<String, String> used = new HashMap<>();

   /**
    * @param caseNum Case number to reserve.
    * @param where Human readable location of the case, used in the error message.
    * @throws DuplicateCaseNumberException if the number is already registered.
    */
   public void register(String caseNum, String where) {
      String previous = used.putIfAbsent(caseNum, where);
      if (previous != null) {
         throw new DuplicateCaseNumberException(caseNum, previous);
      }
   }

   public boolean contains(String caseNum) {
      return used.containsKey(caseNum);
   }

   public int size() {
      return used.size();
   }
}
