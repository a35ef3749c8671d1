package com.muji.web.dto;

import com.muji.model.Profile;

import java.util.ArrayList;
import java.util.List;

public class ProfileRequest {
    public String name;
    public Integer age;
    public String gender;
    public String nationality;
    public String city;
    public List<String> travelCities = new ArrayList<>();
    public String description;
    /** URL уже загруженных фотографий */
    public List<String> photos = new ArrayList<>();
    public Integer height;
    public Integer weight;
    public Integer chest;

    public Profile toDraft() {
        Profile p = new Profile();
        p.name = name;
        p.age = age;
        p.gender = gender;
        p.nationality = nationality;
        p.city = city;
        p.travelCities = travelCities;
        p.description = description;
        p.photos = photos;
        p.height = height;
        p.weight = weight;
        p.chest = chest;
        return p;
    }
}
