package com.launchpad.core.registry;

import com.launchpad.core.model.Phase;

import java.util.List;

/**
 * The standard 15-handler launch pipeline: research, planning, development, launch and
 * monitoring specialists followed by the consolidating final report.
 */
public final class LaunchHandlers {

    private LaunchHandlers() {}

    public static HandlerRegistry standard() {
        return new HandlerRegistry(List.of(
                // ── Research ────────────────────────────────────────────────
                handler("market_intelligence", Phase.RESEARCH,
                        "Market Intelligence Specialist",
                        "Monitor news sources, competitor sites and analyst reports to extract market trends, "
                                + "pricing insights and competitive intelligence",
                        "Top competitors and their recent moves",
                        "Key market trends and growth opportunities",
                        "Competitive pricing strategies and positioning",
                        "Market size estimate and growth outlook",
                        "Main recommendation for product positioning"),
                handler("customer_pulse", Phase.RESEARCH,
                        "Customer Insights Analyst",
                        "Analyze user reviews, social mentions, support tickets and NPS comments to identify "
                                + "pain points, feature requests and customer sentiment",
                        "Overall customer sentiment",
                        "Top three pain points",
                        "Most requested features, ranked by impact",
                        "Main recommendation for the customer experience"),

                // ── Planning ────────────────────────────────────────────────
                handler("requirements_synthesizer", Phase.PLANNING,
                        "Product Requirements Specialist",
                        "Aggregate research findings, goals and stakeholder input into a Product Requirements "
                                + "Document (PRD)",
                        "Core features needed",
                        "Technical requirements",
                        "User requirements",
                        "Success criteria"),
                handler("timeline_resourcing", Phase.PLANNING,
                        "Project Timeline and Resource Specialist",
                        "Build a timeline across development, QA, marketing and legal with resource allocation "
                                + "and dependency management",
                        "Phased delivery timeline",
                        "Team resource allocation",
                        "Key milestones and their dependencies",
                        "Schedule risk mitigation plan"),
                handler("risk_compliance", Phase.PLANNING,
                        "Risk and Compliance Specialist",
                        "Check requirements and workflows for privacy, legal and compliance issues while "
                                + "maintaining a risk register",
                        "Risk register with severity, probability and owner",
                        "Privacy and data-protection findings",
                        "Regulatory and legal considerations",
                        "Mitigation plan for the highest risks"),

                // ── Development ─────────────────────────────────────────────
                handler("dev_coordination", Phase.DEVELOPMENT,
                        "Development Coordination Specialist",
                        "Track sprints, monitor ticket status and flag blockers across the delivery tooling",
                        "Sprint plan aligned with the timeline",
                        "Expected blockers and cross-team dependencies",
                        "Engineering status reporting cadence"),
                handler("qa_testing", Phase.DEVELOPMENT,
                        "QA and Testing Specialist",
                        "Plan automated and manual testing at each build stage and produce a release-readiness "
                                + "checklist",
                        "Test strategy per build stage",
                        "Critical test scenarios derived from the requirements",
                        "Release-readiness checklist"),
                handler("documentation", Phase.DEVELOPMENT,
                        "Technical Documentation Specialist",
                        "Create and update README, changelog and feature documentation for the release",
                        "Documentation plan and owners",
                        "Draft feature overview for users",
                        "Changelog and release-notes outline"),

                // ── Launch ──────────────────────────────────────────────────
                handler("gtm", Phase.LAUNCH,
                        "Go-to-Market Specialist",
                        "Draft press material, launch emails, announcement posts and marketing collateral in "
                                + "sync with marketing and sales calendars",
                        "Positioning statement and key messages",
                        "Channel plan with timing",
                        "Press release and announcement outlines",
                        "Sales enablement notes"),
                handler("readiness_check", Phase.LAUNCH,
                        "Launch Readiness Specialist",
                        "Verify that all launch criteria are met and flag any critical requirement that is unmet",
                        "Pre-launch checklist with pass / fail per item",
                        "Blocking issues, if any",
                        "Go / no-go recommendation with rationale"),
                handler("comms", Phase.LAUNCH,
                        "Stakeholder Communication Specialist",
                        "Update stakeholders on launch status, blockers and next steps through internal and "
                                + "external communications",
                        "Stakeholder map and communication cadence",
                        "Internal launch announcement draft",
                        "External customer communication draft"),

                // ── Monitoring ──────────────────────────────────────────────
                handler("telemetry_kpi", Phase.MONITORING,
                        "Telemetry and KPI Monitoring Specialist",
                        "Define how adoption, usage, error rates, feedback and churn are monitored against targets",
                        "KPI set with targets",
                        "Dashboards and alert thresholds",
                        "Early-warning signals to watch after launch"),
                handler("feedback_loop", Phase.MONITORING,
                        "Post-Launch Feedback Specialist",
                        "Plan how post-launch feedback is collected, summarized into actionable insights and "
                                + "turned into bug and feature tickets",
                        "Feedback sources and collection plan",
                        "Triage process for bugs and feature requests",
                        "Cadence for feeding insights back to the roadmap"),
                handler("retrospective", Phase.MONITORING,
                        "Launch Retrospective Specialist",
                        "Aggregate outcomes, metrics and team feedback into retrospective insights and process "
                                + "improvements",
                        "What is expected to go well",
                        "What is likely to go wrong and how to detect it early",
                        "Process improvements for the next launch"),

                // ── Reporting ───────────────────────────────────────────────
                handler("final_report", Phase.REPORTING,
                        "Launch Program Director",
                        "Consolidate every specialist's output into one coherent launch plan",
                        "Executive summary",
                        "Phase-by-phase highlights",
                        "Key recommendations",
                        "Success metrics",
                        "Next steps with owners")
        ));
    }

    private static HandlerSpec handler(String name, Phase phase, String role, String goal, String... deliverables) {
        return new HandlerSpec(name, phase, role, new TemplatePromptBuilder(role, goal, List.of(deliverables)));
    }
}
