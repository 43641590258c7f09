package io.tower.api.config;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Arguments of a single project run.
 * <p>
 * {@code project}, {@code tag} and {@code serverIpAddress} are mandatory; {@code untag}, {@code feature}
 * and {@code caseLoops} (feature name → case number → loop count) are optional.
 * The server address is passed through to the cases untouched.
 */
public final class RunArguments implements Serializable {
   private final String project;
   private final String tag;
   private final String serverIpAddress;
   private final String untag;
   private final String feature;
   private final Map<String, Map<String, Integer>> caseLoops;
   private final Map<String, String> extra;

   private RunArguments(Builder builder) {
      this.project = builder.project;
      this.tag = builder.tag;
      this.serverIpAddress = builder.serverIpAddress;
      this.untag = builder.untag == null ? "" : builder.untag;
      this.feature = builder.feature == null || builder.feature.isEmpty() ? null : builder.feature;
      Map<String, Map<String, Integer>> loops = new LinkedHashMap<>();
      builder.caseLoops.forEach((f, cases) -> loops.put(f, Collections.unmodifiableMap(new LinkedHashMap<>(cases))));
      this.caseLoops = Collections.unmodifiableMap(loops);
      this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extra));
   }

   public static Builder builder() {
      return new Builder();
   }

   public String project() {
      return project;
   }

   public String tag() {
      return tag;
   }

   public String serverIpAddress() {
      return serverIpAddress;
   }

   public String untag() {
      return untag;
   }

   /**
    * @return Name of the only feature group that should run, or {@code null} for all groups.
    */
   public String feature() {
      return feature;
   }

   public Map<String, Map<String, Integer>> caseLoops() {
      return caseLoops;
   }

   /**
    * @return Additional arguments that the core does not interpret but passes to the cases.
    */
   public Map<String, String> extra() {
      return extra;
   }

   public List<String> tags() {
      return splitTags(tag);
   }

   public List<String> untags() {
      return splitTags(untag);
   }

   static List<String> splitTags(String tags) {
      if (tags == null || tags.isBlank()) {
         return Collections.emptyList();
      }
      return Arrays.stream(tags.split(","))
            .map(String::trim).filter(t -> !t.isEmpty())
            .map(t -> t.toLowerCase(Locale.ROOT))
            .collect(Collectors.toList());
   }

   @Override
   public String toString() {
      return "RunArguments{project='" + project + "', tag='" + tag + "', untag='" + untag + "', feature=" + feature +
            ", serverIpAddress='" + serverIpAddress + "', caseLoops=" + caseLoops + '}';
   }

   public static final class Builder {
      private String project;
      private String tag;
      private String serverIpAddress;
      private String untag;
      private String feature;
      private final Map<String, Map<String, Integer>> caseLoops = new LinkedHashMap<>();
      private final Map<String, String> extra = new LinkedHashMap<>();

      private Builder() {
      }

      public Builder project(String project) {
         this.project = project;
         return this;
      }

      public Builder tag(String tag) {
         this.tag = tag;
         return this;
      }

      public Builder serverIpAddress(String serverIpAddress) {
         this.serverIpAddress = serverIpAddress;
         return this;
      }

      public Builder untag(String untag) {
         this.untag = untag;
         return this;
      }

      public Builder feature(String feature) {
         this.feature = feature;
         return this;
      }

      public Builder caseLoop(String feature, String caseNum, int loop) {
         if (loop < 1) {
            throw new TowerDefinitionException("Loop count for case " + caseNum + " in feature " + feature +
                  " must be at least 1, was " + loop);
         }
         caseLoops.computeIfAbsent(feature, f -> new LinkedHashMap<>()).put(caseNum, loop);
         return this;
      }

      public Builder caseLoops(Map<String, Map<String, Integer>> caseLoops) {
         caseLoops.forEach((f, cases) -> cases.forEach((c, loop) -> caseLoop(f, c, loop)));
         return this;
      }

      public Builder extra(String key, String value) {
         extra.put(key, value);
         return this;
      }

      public RunArguments build() {
         if (isEmpty(project) || isEmpty(tag) || isEmpty(serverIpAddress)) {
            throw new TowerDefinitionException("Run arguments 'project', 'tag' and 'serverIpAddress' are all required; got project="
                  + project + ", tag=" + tag + ", serverIpAddress=" + serverIpAddress);
         }
         return new RunArguments(this);
      }

      private static boolean isEmpty(String s) {
         return s == null || s.isEmpty();
      }
   }
}
