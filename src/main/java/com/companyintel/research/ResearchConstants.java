package com.companyintel.research;

import com.companyintel.research.model.ResearchDomain;

import java.util.List;
import java.util.Map;

public final class ResearchConstants {

    private ResearchConstants() {
        // Private constructor to prevent instantiation
    }

    // Placeholders understood by configurable topic templates
    public static final String COMPANY_PLACEHOLDER = "{company}";
    public static final String ROLE_PLACEHOLDER = "{role}";

    // Domain focus, used as the first query of each worker
    public static final Map<ResearchDomain, String> DOMAIN_FOCUS = Map.of(
            ResearchDomain.PAST, "Research %s history, founding, key milestones, and evolution up to present",
            ResearchDomain.FUTURE, "Research %s future prospects, strategic plans, and growth opportunities",
            ResearchDomain.CULTURE, "Research %s company culture, values, work environment, and employee satisfaction"
    );
    public static final String ROLE_FOCUS_SUFFIX = ", with attention to what matters for a %s position";
    public static final String DEFAULT_OBJECTIVE = "Comprehensive analysis of %s for job seekers";

    // Follow-up queries once the focus query has been issued
    public static final Map<ResearchDomain, List<String>> DEFAULT_TOPICS = Map.of(
            ResearchDomain.PAST, List.of(
                    "{company} founding story and founders",
                    "{company} major milestones acquisitions and product launches",
                    "{company} leadership changes and past challenges"),
            ResearchDomain.FUTURE, List.of(
                    "{company} strategic plans and recent announcements",
                    "{company} growth markets investments and funding",
                    "{company} {role} hiring plans and industry outlook"),
            ResearchDomain.CULTURE, List.of(
                    "{company} company values and mission",
                    "{company} employee reviews and work life balance",
                    "{company} {role} team work environment and benefits")
    );

    // Report layout
    public static final String REPORT_TITLE = "# Company Research Report: %s";
    public static final String REPORT_BRIEF = "_%s_";
    public static final String REPORT_ROLE_CONTEXT = "Role context: %s";
    public static final String NOTES_HEADING = "## Research Notes";
    public static final String TOTAL_FAILURE_MESSAGE = "Research could not be completed: no research domain produced usable findings.";
    public static final String NO_FINDINGS_MESSAGE = "No research findings available.";
    public static final String RENDERING_FAILED_NOTE = "*Note: report rendering failed (%s); showing the collected findings instead.*";

    // Tool and model prompts
    public static final String RESEARCH_TOOL_SYSTEM_PROMPT = """
            You are a company research assistant. Today is %s.
            Answer the research query with verifiable facts only.
            Return only JSON of the form {"summary": "2-5 sentences", "source": "most relevant URL or null"}.
            """;
    public static final String RESEARCH_TOOL_USER_TEMPLATE = """
            Research domain: %s
            Query: %s
            """;
    public static final String REPORT_SYSTEM_PROMPT = """
            You are an expert at synthesizing company research into comprehensive reports for job seekers.
            Use only the findings provided. Write markdown with one section per research area.
            """;
    public static final String REPORT_USER_TEMPLATE = """
            Research brief: %s
            Date: %s

            Findings:
            %s
            """;
    public static final String JOB_ANALYSIS_SYSTEM_PROMPT = """
            You are an expert at analyzing job descriptions to extract key information for company research.
            Return only JSON with the fields "jobTitle", "department", "keyResponsibilities", "requiredSkills",
            "companyValuesMentioned" and "seniorityLevel". Use null for a field the description does not mention
            and an empty list for a list with no entries.
            """;
    public static final String JOB_ANALYSIS_USER_TEMPLATE = """
            Analyze the following job description and extract key information:

            Job Description:
            %s

            Extract the job title, department, key responsibilities, required skills, company values mentioned,
            and seniority level. This information will be used to tailor company research for this specific role.
            """;
    public static final String PLANNING_SYSTEM_PROMPT = """
            You are an expert research planner specializing in company analysis for job seekers.
            Return only JSON with the fields "researchObjectives" (list), "pastResearchFocus",
            "futureResearchFocus", "cultureResearchFocus" and "jobSpecificConsiderations" (list).
            Each focus is one sentence that names the company.
            """;
    public static final String PLANNING_USER_TEMPLATE = """
            Create a comprehensive company research plan for a job seeker:

            %s

            Plan detailed research objectives and focus areas for three specialized research agents:
            1. Past Research Agent (company history and background)
            2. Future Research Agent (strategic plans and growth prospects)
            3. Culture Research Agent (values, work environment, employee satisfaction)

            Consider any job-specific context to tailor the research appropriately.
            """;
}
