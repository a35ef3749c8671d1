package com.muji.repo;

import java.util.Random;

/** Отображаемые номера заказов: 18 символов из [A-Za-z0-9]. Это метка, а не секрет. */
public class OrderCodes {
    public static final int LENGTH = 18;
    static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final Random random;

    public OrderCodes() { this(new Random()); }
    public OrderCodes(Random random) { this.random = random; }

    public String next() {
        StringBuilder sb = new StringBuilder(LENGTH);
        for (int i = 0; i < LENGTH; i++) sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        return sb.toString();
    }
}
