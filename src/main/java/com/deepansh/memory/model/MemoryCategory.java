package com.deepansh.memory.model;

public enum MemoryCategory {
    WORK_LIFE,
    PERSONAL_LIFE,
    HEALTH_WELLNESS,
    RELATIONSHIPS,
    GOALS_ASPIRATIONS,
    PREFERENCES,
    BELIEFS_VALUES,
    SKILLS_EXPERTISE,
    PROJECTS,
    CHALLENGES,
    GENERAL
}
