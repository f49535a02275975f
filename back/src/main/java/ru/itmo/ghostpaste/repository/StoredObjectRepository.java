package ru.itmo.ghostpaste.repository;

import ru.itmo.ghostpaste.model.StoredObject;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StoredObjectRepository extends JpaRepository<StoredObject, String> {

    /**
     * @param pattern a LIKE pattern using {@code !} as the escape character
     */
    @Query("SELECT o.objectKey FROM StoredObject o WHERE o.objectKey LIKE ?1 ESCAPE '!' ORDER BY o.objectKey")
    List<String> findKeysLike(String pattern);
}
