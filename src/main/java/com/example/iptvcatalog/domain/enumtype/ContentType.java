package com.example.iptvcatalog.domain.enumtype;

public enum ContentType {
    LIVESTREAM,
    MOVIE,
    EPISODE
}
