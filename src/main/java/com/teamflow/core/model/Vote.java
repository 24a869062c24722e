package com.teamflow.core.model;

import java.io.Serializable;

public record Vote(String voterId, boolean approve) implements Serializable {}
