package com.muji.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class Profile {
    public long id;
    public String name;
    public Integer age;
    public String gender;
    public String nationality;
    public String city;
    public List<String> travelCities = new ArrayList<>();
    public String description;
    /** URL фотографий, первая идёт на обложку */
    public List<String> photos = new ArrayList<>();
    public Integer height;
    public Integer weight;
    public Integer chest;
    public boolean visible = true;
    public Instant createdAt;

    public String coverPhoto() {
        return photos == null || photos.isEmpty() ? null : photos.get(0);
    }
}
