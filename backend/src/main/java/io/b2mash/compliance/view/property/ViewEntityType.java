package io.b2mash.compliance.view.property;

/** List-based business modules that support saved views. */
public enum ViewEntityType {
  CASES,
  INVESTIGATIONS,
  INTAKE_FORMS,
  PERSONS,
  CAMPAIGNS,
  POLICIES,
  DISCLOSURES,
  REMEDIATION_PLANS
}
