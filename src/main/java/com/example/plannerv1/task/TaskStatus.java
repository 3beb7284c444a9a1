package com.example.plannerv1.task;

public enum TaskStatus { IN_PROGRESS, FORWARD, COMPLETE, CANCELLED, DELEGATE }
