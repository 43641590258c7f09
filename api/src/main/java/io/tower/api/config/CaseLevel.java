package io.tower.api.config;

public enum CaseLevel {
   PROJECT,
   FEATURE
}
