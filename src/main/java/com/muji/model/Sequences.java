package com.muji.model;

/** Последний выданный id по каждой коллекции: id не переиспользуются после удалений. */
public class Sequences {
    public long profile;
    public long chat;
    public long message;
    public long order;
    public long comment;
    public long promocode;
}
