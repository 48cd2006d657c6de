package com.example.stlabels.service.extraction;

import java.util.Optional;

/**
 * Стратегия поиска адреса устройства (X0, Y10, M100, D200, T5) для глобальной метки.
 * <p>
 * Поиск эвристический: упоминание "D200" в комментарии может оказаться
 * количеством, а не регистром.
 */
public interface DeviceAddressMatcher {

    /**
     * Ищет адрес устройства сначала в комментарии, затем в имени метки.
     *
     * @param name    имя метки
     * @param comment комментарий (может быть null)
     * @return адрес в верхнем регистре или пустой Optional
     */
    Optional<String> findDevice(String name, String comment);
}
