package com.example.plannerv1.task;

/**
 * A=必須 B=重要 C=任意 D=委任
 */
public enum PriorityLetter { A, B, C, D }
