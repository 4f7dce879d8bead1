package ru.marthastudios.nudgebot.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.marthastudios.nudgebot.entity.User;
import ru.marthastudios.nudgebot.repository.UserRepository;

@Service
@RequiredArgsConstructor
public class UserService {
    private final UserRepository userRepository;

    public boolean existsByAzureAdId(String azureAdId){
        return userRepository.existsByAzureAdId(azureAdId);
    }

    /**
     * Creates the user row on first contact, or refreshes the UPN if it changed in the directory.
     */
    @Transactional
    public User createOrUpdate(String upn, String azureAdId){
        User user = userRepository.findByAzureAdId(azureAdId);

        if (user == null) {
            user = User.builder()
                    .upn(upn)
                    .azureAdId(azureAdId)
                    .build();
        } else if (upn.equals(user.getUpn())) {
            return user;
        } else {
            user.setUpn(upn);
        }

        return userRepository.save(user);
    }
}
