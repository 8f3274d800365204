package com.propertyintel.housekeeping.model;

import lombok.Value;

@Value
public class Kpi {

    String name;
    String value;
}
