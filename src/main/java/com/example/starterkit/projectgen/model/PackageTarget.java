package com.example.starterkit.projectgen.model;

public enum PackageTarget {
    BACKEND,
    WEB,
    ALL
}
