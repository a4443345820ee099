package com.github.fsmhub.machines;

public enum ArchitectureState {
  REQUIREMENTS_ANALYSIS, SYSTEM_DESIGN, TECHNICAL_SPECIFICATION, QUALITY_ATTRIBUTE_ANALYSIS,
  COMPLIANCE_VALIDATION, DOCUMENTATION_GENERATION, ARCHITECTURE_OPTIMIZATION, COMPLETE, FAILED;
}
