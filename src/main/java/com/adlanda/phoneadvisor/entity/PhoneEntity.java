package com.adlanda.phoneadvisor.entity;

import com.adlanda.phoneadvisor.model.PhoneRecord;
import jakarta.persistence.*;

/**
 * JPA entity for one row of the {@code phones} table.
 */
@Entity
@Table(name = "phones")
public class PhoneEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "model_name", unique = true, nullable = false, length = 255)
    private String modelName;

    @Column(name = "release_date", length = 100)
    private String releaseDate;

    @Column(name = "display", columnDefinition = "TEXT")
    private String display;

    @Column(name = "battery", length = 255)
    private String battery;

    @Column(name = "camera", columnDefinition = "TEXT")
    private String camera;

    @Column(name = "ram", length = 100)
    private String ram;

    @Column(name = "storage", length = 255)
    private String storage;

    @Column(name = "price", length = 100)
    private String price;

    @Column(name = "chipset", length = 255)
    private String chipset;

    @Column(name = "os", length = 255)
    private String os;

    @Column(name = "body", columnDefinition = "TEXT")
    private String body;

    @Column(name = "url", length = 500)
    private String url;

    // Default constructor for JPA
    protected PhoneEntity() {
    }

    public static PhoneEntity from(PhoneRecord record) {
        PhoneEntity entity = new PhoneEntity();
        entity.modelName = record.modelName();
        entity.releaseDate = record.releaseDate();
        entity.display = record.display();
        entity.battery = record.battery();
        entity.camera = record.camera();
        entity.ram = record.ram();
        entity.storage = record.storage();
        entity.price = record.price();
        entity.chipset = record.chipset();
        entity.os = record.os();
        entity.body = record.body();
        entity.url = record.url();
        return entity;
    }

    /**
     * Detached snapshot of this row.
     */
    public PhoneRecord toRecord() {
        return new PhoneRecord(modelName, releaseDate, display, battery, camera, ram,
                storage, price, chipset, os, body, url);
    }

    public Long getId() {
        return id;
    }

    public String getModelName() {
        return modelName;
    }

    @Override
    public String toString() {
        return "PhoneEntity{" +
                "id=" + id +
                ", modelName='" + modelName + '\'' +
                ", price='" + price + '\'' +
                '}';
    }
}
