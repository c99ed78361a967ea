package com.offy.competition.model;

public enum GoalType {
    DAILY,
    WEEKLY
}
