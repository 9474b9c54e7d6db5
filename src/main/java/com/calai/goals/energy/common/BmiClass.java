package com.calai.goals.energy.common;

public enum BmiClass { Underweight, Normal, Overweight, Obesity }
